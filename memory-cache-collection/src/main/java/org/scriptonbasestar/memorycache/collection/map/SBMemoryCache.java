package org.scriptonbasestar.memorycache.collection.map;

import org.scriptonbasestar.memorycache.collection.metrics.CacheMetrics;
import org.scriptonbasestar.memorycache.collection.metrics.CacheStats;
import org.scriptonbasestar.memorycache.core.key.MemoryKey;
import org.scriptonbasestar.memorycache.core.util.TimeCheckerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @author archmagece
 * @since 2025-01
 *
 *		SBMemoryCache cache = SBMemoryCache.builder()
 *			.capacity(1000)
 *			.defaultTtl(Duration.ofHours(1))
 *			.build();
 *
 *		MemoryKey key = MemoryKey.of("langgraph_agent", "decision", "healing_strategy");
 *		Map<String, Object> memory = cache.get(key);
 *		if (memory == null) {
 *			memory = store.load(key);
 *			if (memory != null) {
 *				cache.put(key, memory);
 *			}
 *		}
 *
 * 	Features:
 * 	- LRU: capacity 초과 시 가장 오래 전에 사용(삽입/조회)된 항목을 제거
 * 	- TTL: 생성 시점 기준 만료, 조회 시점에 lazy하게 검사 (백그라운드 스레드 없음)
 * 	- Per-item TTL: put(key, data, ttl)로 항목별 TTL 지정
 * 	- Owner 단위 삭제: clearForOwner(owner)
 * 	- 통계: 히트/미스/축출/만료 카운터 (stats())
 *
 * 	모든 public 메서드는 하나의 락을 한 번만 잡고, 락을 잡은 채로 다른 public 메서드를 호출하지 않습니다.
 * 	get도 recency와 카운터를 바꾸므로 쓰기 작업으로 취급합니다.
 * 	cleanupExpired, getAllEntries, clearForOwner는 O(n)이며 수행 동안 다른 모든 작업이 대기합니다.
 */
public class SBMemoryCache {

	private static final Logger log = LoggerFactory.getLogger(SBMemoryCache.class);

	private final Object lock = new Object();
	private final LinkedHashMap<MemoryKey, MemoryCacheEntry> entries;  // 삽입 순서 = recency 순서, 첫 항목이 LRU
	private final CacheMetrics metrics;
	private final MemoryCacheConfig config;
	private final Clock clock;

	public SBMemoryCache(MemoryCacheConfig config) {
		this(config, Clock.systemUTC());
	}

	public SBMemoryCache(MemoryCacheConfig config, Clock clock) {
		if (config == null) {
			throw new IllegalArgumentException("config must not be null");
		}
		if (clock == null) {
			throw new IllegalArgumentException("clock must not be null");
		}
		this.config = config;
		this.clock = clock;
		this.metrics = new CacheMetrics();
		this.entries = new LinkedHashMap<>(Math.min(config.capacity(), 1024) * 4 / 3 + 1);
		log.debug("SBMemoryCache created: {}", config);
	}

	/**
	 * Builder 패턴을 사용하여 SBMemoryCache를 생성합니다.
	 *
	 * @return Builder 인스턴스
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * SBMemoryCache Builder 클래스
	 */
	public static class Builder {
		private int capacity = MemoryCacheConfig.DEFAULT_CAPACITY;
		private Duration defaultTtl = null; // 기본값: 만료 없음
		private Clock clock = Clock.systemUTC();

		/**
		 * 최대 캐시 크기를 설정합니다.
		 * 크기 초과 시 가장 오래 전에 사용된 항목이 제거됩니다 (LRU).
		 *
		 * @param capacity 최대 크기 (양수)
		 * @return Builder 인스턴스
		 */
		public Builder capacity(int capacity) {
			this.capacity = capacity;
			return this;
		}

		/**
		 * 기본 TTL을 설정합니다. null 또는 0이면 put 시 TTL을 주지 않은 항목은 만료되지 않습니다.
		 *
		 * @param ttl 기본 TTL
		 * @return Builder 인스턴스
		 */
		public Builder defaultTtl(Duration ttl) {
			this.defaultTtl = ttl;
			return this;
		}

		/**
		 * 만료 판단에 사용할 시계를 설정합니다 (테스트용).
		 *
		 * @param clock 시계
		 * @return Builder 인스턴스
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public SBMemoryCache build() {
			return new SBMemoryCache(new MemoryCacheConfig(capacity, defaultTtl), clock);
		}
	}

	public void put(MemoryKey key, Map<String, Object> data) {
		put(key, data, null);
	}

	public void put(String owner, String category, String subKey, Map<String, Object> data) {
		put(MemoryKey.of(owner, category, subKey), data, null);
	}

	public void put(String owner, String category, String subKey, Map<String, Object> data, Duration ttl) {
		put(MemoryKey.of(owner, category, subKey), data, ttl);
	}

	/**
	 * 항목을 저장합니다. 같은 키가 있으면 새 항목으로 교체하며 TTL도 다시 계산됩니다.
	 * 저장된 항목은 가장 최근 사용(MRU) 위치가 되고, capacity를 넘으면 LRU 항목이 제거됩니다.
	 *
	 * @param key 키
	 * @param data 값 (최상위 맵만 복사되어 저장됨, 중첩된 맵/리스트는 호출자와 공유)
	 * @param ttlOverride 이 항목의 TTL, null이면 기본 TTL 사용
	 */
	public void put(MemoryKey key, Map<String, Object> data, Duration ttlOverride) {
		requireKey(key);
		if (data == null) {
			throw new IllegalArgumentException("data must not be null");
		}
		TimeCheckerUtil.requireNonNegative(ttlOverride, "ttl");
		Duration ttl = ttlOverride != null ? ttlOverride : config.defaultTtl();

		synchronized (lock) {
			log.trace("put data - key : {}, ttl : {}", key, ttl);
			MemoryCacheEntry entry = new MemoryCacheEntry(data, clock.instant(), ttl);
			// 기존 항목을 지워야 MRU 위치로 다시 들어감
			entries.remove(key);
			entries.put(key, entry);
			evictIfNecessary();
		}
	}

	/**
	 * capacity 초과 시 가장 오래된 항목 제거 (LRU). 락 안에서만 호출합니다.
	 */
	private void evictIfNecessary() {
		Iterator<MemoryKey> iterator = entries.keySet().iterator();
		while (entries.size() > config.capacity() && iterator.hasNext()) {
			MemoryKey victimKey = iterator.next();
			iterator.remove();
			metrics.recordEviction(1);
			log.trace("Evicting key due to capacity: {}", victimKey);
		}
	}

	public Map<String, Object> get(String owner, String category, String subKey) {
		return get(MemoryKey.of(owner, category, subKey));
	}

	/**
	 * 캐시에서 값을 조회합니다. 저장소에서 로드하지 않습니다.
	 * <p>
	 * 히트 시 항목은 MRU 위치로 이동하고 접근 횟수가 증가합니다.
	 * 만료된 항목은 이 시점에 제거되고 미스로 기록됩니다.
	 * </p>
	 *
	 * @param key 조회할 키
	 * @return 캐시된 값, 없거나 만료된 경우 null
	 */
	public Map<String, Object> get(MemoryKey key) {
		requireKey(key);
		synchronized (lock) {
			MemoryCacheEntry entry = entries.get(key);
			if (entry == null) {
				metrics.recordMiss();
				log.trace("get miss - key : {}", key);
				return null;
			}

			if (entry.isExpired(clock.instant())) {
				entries.remove(key);
				metrics.recordExpiration(1);
				metrics.recordMiss();
				log.trace("get expired - key : {}", key);
				return null;
			}

			// LRU 업데이트 (MRU 위치로 이동)
			entries.remove(key);
			entries.put(key, entry);
			entry.touch();
			metrics.recordHit();
			log.trace("get hit - key : {}", key);
			return entry.data();
		}
	}

	public boolean remove(String owner, String category, String subKey) {
		return remove(MemoryKey.of(owner, category, subKey));
	}

	/**
	 * 항목을 제거합니다. 만료 여부는 확인하지 않습니다.
	 *
	 * @param key 키
	 * @return 항목이 있었으면 true
	 */
	public boolean remove(MemoryKey key) {
		requireKey(key);
		synchronized (lock) {
			return entries.remove(key) != null;
		}
	}

	/**
	 * owner 필드가 정확히 일치하는 모든 항목을 제거합니다.
	 *
	 * @param owner owner
	 * @return 제거된 항목 수
	 */
	public int clearForOwner(String owner) {
		if (owner == null) {
			throw new IllegalArgumentException("owner must not be null");
		}
		synchronized (lock) {
			int removed = 0;
			Iterator<MemoryKey> iterator = entries.keySet().iterator();
			while (iterator.hasNext()) {
				if (iterator.next().isOwnedBy(owner)) {
					iterator.remove();
					removed++;
				}
			}
			log.debug("Cleared {} entries for owner: {}", removed, owner);
			return removed;
		}
	}

	/**
	 * 현재 시각 기준으로 만료된 항목들을 제거합니다.
	 *
	 * @return 제거된 항목 수
	 */
	public int cleanupExpired() {
		return cleanupExpired(clock.instant());
	}

	/**
	 * 주어진 시각 기준으로 만료된 항목들을 제거합니다.
	 *
	 * @param now 기준 시각
	 * @return 제거된 항목 수
	 */
	public int cleanupExpired(Instant now) {
		if (now == null) {
			throw new IllegalArgumentException("now must not be null");
		}
		synchronized (lock) {
			int removed = 0;
			Iterator<Map.Entry<MemoryKey, MemoryCacheEntry>> iterator = entries.entrySet().iterator();
			while (iterator.hasNext()) {
				Map.Entry<MemoryKey, MemoryCacheEntry> entry = iterator.next();
				if (entry.getValue().isExpired(now)) {
					iterator.remove();
					removed++;
					log.trace("Removed expired key: {}", entry.getKey());
				}
			}
			if (removed > 0) {
				metrics.recordExpiration(removed);
				log.debug("Cleaned up {} expired entries", removed);
			}
			return removed;
		}
	}

	/**
	 * 모든 캐시 항목을 제거하고 통계를 초기화합니다.
	 */
	public void clearAll() {
		synchronized (lock) {
			entries.clear();
			metrics.reset();
			log.debug("Cleared all entries and statistics");
		}
	}

	public Map<MemoryKey, Map<String, Object>> getAllEntries() {
		return getAllEntries(null);
	}

	/**
	 * 만료되지 않은 항목들의 스냅샷을 LRU → MRU 순서로 반환합니다.
	 * 진단용이며 recency, 접근 횟수, 히트/미스 카운터를 바꾸지 않습니다.
	 * 만료된 항목은 결과에서 빠지지만 제거되지는 않습니다.
	 *
	 * @param owner owner 필터, null이면 전체
	 * @return 수정 불가능한 키-값 맵
	 */
	public Map<MemoryKey, Map<String, Object>> getAllEntries(String owner) {
		synchronized (lock) {
			Instant now = clock.instant();
			Map<MemoryKey, Map<String, Object>> result = new LinkedHashMap<>();
			for (Map.Entry<MemoryKey, MemoryCacheEntry> entry : entries.entrySet()) {
				if (owner != null && !entry.getKey().isOwnedBy(owner)) {
					continue;
				}
				if (!entry.getValue().isExpired(now)) {
					result.put(entry.getKey(), entry.getValue().data());
				}
			}
			return Collections.unmodifiableMap(result);
		}
	}

	/**
	 * 항목의 접근 횟수를 반환합니다 (진단용, recency와 카운터를 바꾸지 않음).
	 *
	 * @param key 키
	 * @return 접근 횟수, 항목이 없으면 -1
	 */
	public long accessCount(MemoryKey key) {
		requireKey(key);
		synchronized (lock) {
			MemoryCacheEntry entry = entries.get(key);
			return entry == null ? -1 : entry.accessCount();
		}
	}

	/**
	 * 캐시 통계 스냅샷을 반환합니다.
	 *
	 * @return CacheStats
	 */
	public CacheStats stats() {
		synchronized (lock) {
			return new CacheStats(clock.millis(), entries.size(), config.capacity(), metrics);
		}
	}

	public int size() {
		synchronized (lock) {
			return entries.size();
		}
	}

	public int capacity() {
		return config.capacity();
	}

	/**
	 * @return 기본 TTL, 설정되지 않았으면 null
	 */
	public Duration defaultTtl() {
		return config.defaultTtl();
	}

	public MemoryCacheConfig config() {
		return config;
	}

	private static void requireKey(MemoryKey key) {
		if (key == null) {
			throw new IllegalArgumentException("key must not be null");
		}
	}

	@Override
	public String toString() {
		return "SBMemoryCache{" + config + ", " + stats() + '}';
	}
}
