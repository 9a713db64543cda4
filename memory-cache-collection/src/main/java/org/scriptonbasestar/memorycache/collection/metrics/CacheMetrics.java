package org.scriptonbasestar.memorycache.collection.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 캐시 히트/미스 카운터
 *
 * SBMemoryCache가 자신의 락 안에서만 갱신합니다. 히트/미스는 get 호출마다 정확히 한 번
 * 기록되며 put, remove, 스캔 작업에서는 변하지 않습니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong evictionCount = new AtomicLong(0);
	private final AtomicLong expirationCount = new AtomicLong(0);

	/**
	 * 캐시 히트 횟수를 증가시킵니다.
	 */
	public void recordHit() {
		hitCount.incrementAndGet();
	}

	/**
	 * 캐시 미스 횟수를 증가시킵니다.
	 */
	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * LRU 축출을 기록합니다.
	 *
	 * @param count 축출된 항목 수
	 */
	public void recordEviction(int count) {
		evictionCount.addAndGet(count);
	}

	/**
	 * 만료로 제거된 항목을 기록합니다.
	 *
	 * @param count 제거된 항목 수
	 */
	public void recordExpiration(int count) {
		expirationCount.addAndGet(count);
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	/**
	 * 총 요청 횟수를 반환합니다 (히트 + 미스).
	 *
	 * @return 총 요청 횟수
	 */
	public long requestCount() {
		return hitCount.get() + missCount.get();
	}

	/**
	 * 캐시 히트율을 백분율로 계산합니다.
	 *
	 * @return 히트율 (0 ~ 100), 요청이 없으면 0
	 */
	public double hitRatePercent() {
		return CacheStats.percent(hitCount.get(), missCount.get());
	}

	public long evictionCount() {
		return evictionCount.get();
	}

	public long expirationCount() {
		return expirationCount.get();
	}

	/**
	 * 모든 통계를 초기화합니다.
	 */
	public void reset() {
		hitCount.set(0);
		missCount.set(0);
		evictionCount.set(0);
		expirationCount.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"CacheMetrics{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, evictions=%d, expirations=%d}",
			requestCount(),
			hitCount(),
			missCount(),
			hitRatePercent(),
			evictionCount(),
			expirationCount()
		);
	}
}
