package org.scriptonbasestar.memorycache.collection.support;

import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;
import org.scriptonbasestar.memorycache.core.exception.SBCacheLoadFailException;
import org.scriptonbasestar.memorycache.core.exception.SBCacheStoreException;
import org.scriptonbasestar.memorycache.core.key.MemoryKey;
import org.scriptonbasestar.memorycache.core.store.SBMemoryStore;
import org.scriptonbasestar.memorycache.core.util.TimeCheckerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Cache-aside 흐름을 묶어둔 헬퍼
 * <p>
 * 캐시를 먼저 조회하고, 미스면 저장소에서 읽어 캐시를 채웁니다.
 * 저장소 호출은 캐시 락 밖에서 일어납니다. 캐시는 저장소를 모르며,
 * 저장소 예외는 그대로 호출자에게 전달됩니다.
 * </p>
 *
 * <pre>{@code
 * CacheAsideLoader loader = new CacheAsideLoader(cache, agentMemoryStore);
 * Map<String, Object> memory = loader.get(MemoryKey.of("agent", "decision", "strategy"));
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheAsideLoader {

	private static final Logger log = LoggerFactory.getLogger(CacheAsideLoader.class);

	private final SBMemoryCache cache;
	private final SBMemoryStore store;

	public CacheAsideLoader(SBMemoryCache cache, SBMemoryStore store) {
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		if (store == null) {
			throw new IllegalArgumentException("store must not be null");
		}
		this.cache = cache;
		this.store = store;
	}

	/**
	 * 캐시를 조회하고, 미스면 저장소에서 로드하여 캐시에 넣습니다.
	 *
	 * @param key 키
	 * @return 값, 저장소에도 없으면 null
	 * @throws SBCacheLoadFailException 저장소 읽기 실패 시
	 */
	public Map<String, Object> get(MemoryKey key) throws SBCacheLoadFailException {
		Map<String, Object> cached = cache.get(key);
		if (cached != null) {
			return cached;
		}

		long loadStartTime = System.nanoTime();
		Map<String, Object> loaded = store.load(key);
		if (loaded == null) {
			log.trace("Not found in store - key : {}", key);
			return null;
		}
		cache.put(key, loaded);
		log.trace("Loaded from store - key : {}, {}μs", key, (System.nanoTime() - loadStartTime) / 1000);
		return loaded;
	}

	public Map<String, Object> get(String owner, String category, String subKey) {
		return get(MemoryKey.of(owner, category, subKey));
	}

	public void save(MemoryKey key, Map<String, Object> record) throws SBCacheStoreException {
		save(key, record, null);
	}

	/**
	 * 저장소에 먼저 기록한 뒤 캐시를 채웁니다. 저장 실패 시 캐시는 바뀌지 않습니다.
	 * 캐시가 거부할 인자는 저장소에 쓰기 전에 검사합니다.
	 *
	 * @param key 키
	 * @param record 레코드
	 * @param ttl 캐시 항목 TTL, null이면 캐시 기본 TTL
	 * @throws IllegalArgumentException key, record가 null이거나 TTL이 음수인 경우
	 * @throws SBCacheStoreException 저장소 쓰기 실패 시
	 */
	public void save(MemoryKey key, Map<String, Object> record, Duration ttl) throws SBCacheStoreException {
		if (key == null) {
			throw new IllegalArgumentException("key must not be null");
		}
		if (record == null) {
			throw new IllegalArgumentException("record must not be null");
		}
		TimeCheckerUtil.requireNonNegative(ttl, "ttl");

		store.save(key, record);
		cache.put(key, record, ttl);
	}

	/**
	 * 캐시 항목만 무효화합니다. 저장소는 건드리지 않습니다.
	 *
	 * @param key 키
	 * @return 캐시에 있었으면 true
	 */
	public boolean invalidate(MemoryKey key) {
		return cache.remove(key);
	}
}
