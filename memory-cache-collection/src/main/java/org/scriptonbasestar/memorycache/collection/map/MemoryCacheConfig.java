package org.scriptonbasestar.memorycache.collection.map;

import org.scriptonbasestar.memorycache.core.exception.SBCacheConfigException;

import java.time.Duration;
import java.util.Objects;

/**
 * 캐시 생성 설정 (capacity, defaultTtl)
 *
 * <p>capacity는 필수이며 양수여야 합니다. defaultTtl이 null 또는 0이면
 * put 시 TTL을 따로 주지 않은 항목은 만료되지 않습니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
public final class MemoryCacheConfig {

	public static final int DEFAULT_CAPACITY = 1000;
	public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

	/**
	 * 공유 인스턴스 기본 설정 (capacity 1000, TTL 3600초)
	 */
	public static final MemoryCacheConfig DEFAULT = new MemoryCacheConfig(DEFAULT_CAPACITY, DEFAULT_TTL);

	private final int capacity;
	private final Duration defaultTtl;

	/**
	 * @param capacity 최대 항목 수 (양수)
	 * @param defaultTtl 기본 TTL, null 또는 0이면 비활성화
	 * @throws SBCacheConfigException capacity가 0 이하이거나 TTL이 음수인 경우
	 */
	public MemoryCacheConfig(int capacity, Duration defaultTtl) {
		if (capacity <= 0) {
			throw new SBCacheConfigException("capacity must be positive: " + capacity);
		}
		if (defaultTtl != null && defaultTtl.isNegative()) {
			throw new SBCacheConfigException("defaultTtl must not be negative: " + defaultTtl);
		}
		this.capacity = capacity;
		this.defaultTtl = defaultTtl == null || defaultTtl.isZero() ? null : defaultTtl;
	}

	public static MemoryCacheConfig of(int capacity, Duration defaultTtl) {
		return new MemoryCacheConfig(capacity, defaultTtl);
	}

	public int capacity() {
		return capacity;
	}

	/**
	 * @return 기본 TTL, 설정되지 않았으면 null
	 */
	public Duration defaultTtl() {
		return defaultTtl;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof MemoryCacheConfig)) return false;
		MemoryCacheConfig that = (MemoryCacheConfig) o;
		return capacity == that.capacity && Objects.equals(defaultTtl, that.defaultTtl);
	}

	@Override
	public int hashCode() {
		return Objects.hash(capacity, defaultTtl);
	}

	@Override
	public String toString() {
		return "MemoryCacheConfig{capacity=" + capacity + ", defaultTtl=" + defaultTtl + '}';
	}
}
