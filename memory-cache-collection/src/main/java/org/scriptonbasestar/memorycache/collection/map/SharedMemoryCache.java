package org.scriptonbasestar.memorycache.collection.map;

import org.scriptonbasestar.memorycache.core.exception.SBCacheConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 프로세스 전역 공유 SBMemoryCache 인스턴스를 제공합니다.
 * <p>
 * 가능하면 SBMemoryCache를 직접 생성해서 주입하세요 (Spring 모듈은 빈 하나를 주입합니다).
 * 이 클래스는 주입 경로가 없는 코드를 위한 편의 팩토리입니다.
 * </p>
 *
 * <ul>
 *   <li>인스턴스는 첫 호출 시점에 첫 호출자의 설정으로 생성됩니다.</li>
 *   <li>이후 다른 설정으로 요청하면 무시하지 않고 {@link SBCacheConfigException}을 던집니다.
 *       같은 설정이면 기존 인스턴스를 반환합니다.</li>
 *   <li>{@link #reset()}으로 공유 인스턴스를 버리고 다음 호출에서 새로 만들 수 있습니다 (테스트 격리용).</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
public final class SharedMemoryCache {

	private static final Logger log = LoggerFactory.getLogger(SharedMemoryCache.class);

	private static SBMemoryCache instance;

	private SharedMemoryCache() {
		// Utility class
	}

	/**
	 * 공유 인스턴스를 반환합니다. 없으면 {@link MemoryCacheConfig#DEFAULT}로 생성합니다.
	 * 이미 있으면 설정과 관계없이 그 인스턴스를 반환합니다.
	 *
	 * @return 공유 인스턴스
	 */
	public static synchronized SBMemoryCache getInstance() {
		if (instance == null) {
			instance = create(MemoryCacheConfig.DEFAULT);
		}
		return instance;
	}

	public static SBMemoryCache getInstance(int capacity, Duration defaultTtl) {
		return getInstance(new MemoryCacheConfig(capacity, defaultTtl));
	}

	/**
	 * 공유 인스턴스를 반환합니다. 없으면 주어진 설정으로 생성합니다.
	 *
	 * @param config 요청 설정
	 * @return 공유 인스턴스
	 * @throws SBCacheConfigException 이미 다른 설정으로 생성된 인스턴스가 있는 경우
	 */
	public static synchronized SBMemoryCache getInstance(MemoryCacheConfig config) {
		if (config == null) {
			throw new IllegalArgumentException("config must not be null");
		}
		if (instance == null) {
			instance = create(config);
		} else if (!instance.config().equals(config)) {
			throw new SBCacheConfigException("Shared memory cache already initialized with "
				+ instance.config() + ", requested " + config);
		}
		return instance;
	}

	public static synchronized boolean isInitialized() {
		return instance != null;
	}

	/**
	 * 공유 인스턴스를 버립니다. 기존 인스턴스를 들고 있는 쪽에는 영향이 없습니다.
	 */
	public static synchronized void reset() {
		if (instance != null) {
			log.info("Shared memory cache reset: {}", instance.config());
			instance = null;
		}
	}

	private static SBMemoryCache create(MemoryCacheConfig config) {
		log.info("Shared memory cache created: {}", config);
		return new SBMemoryCache(config);
	}
}
