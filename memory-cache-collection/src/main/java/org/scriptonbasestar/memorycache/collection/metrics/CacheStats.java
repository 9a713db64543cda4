package org.scriptonbasestar.memorycache.collection.metrics;

import java.time.Instant;

/**
 * 캐시 통계의 불변 스냅샷
 *
 * SBMemoryCache.stats()가 락 안에서 생성하므로 size와 카운터가 같은 시점의 값입니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheStats {

	private final long timestamp;
	private final int size;
	private final int capacity;
	private final long hitCount;
	private final long missCount;
	private final long evictionCount;
	private final long expirationCount;

	/**
	 * @param timestamp 스냅샷 시각 (epoch milliseconds, 캐시의 Clock 기준)
	 * @param size 현재 항목 수
	 * @param capacity 최대 항목 수
	 * @param metrics 카운터
	 */
	public CacheStats(long timestamp, int size, int capacity, CacheMetrics metrics) {
		this(timestamp, size, capacity, metrics.hitCount(), metrics.missCount(),
			metrics.evictionCount(), metrics.expirationCount());
	}

	public CacheStats(
		long timestamp,
		int size,
		int capacity,
		long hitCount,
		long missCount,
		long evictionCount,
		long expirationCount
	) {
		this.timestamp = timestamp;
		this.size = size;
		this.capacity = capacity;
		this.hitCount = hitCount;
		this.missCount = missCount;
		this.evictionCount = evictionCount;
		this.expirationCount = expirationCount;
	}

	/**
	 * 스냅샷 생성 시간 (epoch milliseconds)
	 */
	public long timestamp() {
		return timestamp;
	}

	public Instant instant() {
		return Instant.ofEpochMilli(timestamp);
	}

	/**
	 * 현재 항목 수
	 */
	public int size() {
		return size;
	}

	/**
	 * 최대 항목 수
	 */
	public int capacity() {
		return capacity;
	}

	public long hitCount() {
		return hitCount;
	}

	public long missCount() {
		return missCount;
	}

	/**
	 * 총 요청 횟수 (히트 + 미스)
	 */
	public long requestCount() {
		return hitCount + missCount;
	}

	/**
	 * 히트율 (0 ~ 100). 요청이 없으면 0
	 */
	public double hitRatePercent() {
		return percent(hitCount, missCount);
	}

	public long evictionCount() {
		return evictionCount;
	}

	public long expirationCount() {
		return expirationCount;
	}

	/**
	 * capacity 대비 사용률 (0 ~ 100)
	 */
	public double fillPercent() {
		return capacity <= 0 ? 0.0 : (size * 100.0) / capacity;
	}

	static double percent(long hits, long misses) {
		long total = hits + misses;
		return total == 0 ? 0.0 : (hits * 100.0) / total;
	}

	@Override
	public String toString() {
		return String.format(
			"CacheStats{size=%d, capacity=%d, requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, " +
			"evictions=%d, expirations=%d}",
			size,
			capacity,
			requestCount(),
			hitCount,
			missCount,
			hitRatePercent(),
			evictionCount,
			expirationCount
		);
	}
}
