package org.scriptonbasestar.memorycache.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;

import java.util.function.Supplier;

/**
 * Micrometer MeterRegistry와 SBMemoryCache 통계를 연동하는 어댑터
 *
 * 게이지와 FunctionCounter는 스크레이프 시점에 cache.stats()를 읽으므로 별도 동기화가 필요 없습니다.
 * clearAll()은 카운터를 0으로 되돌리므로 누적 카운터 값도 함께 줄어듭니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * SBMemoryCache cache = SBMemoryCache.builder().capacity(1000).build();
 *
 * MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(cache, registry, "agent-memory");
 * adapter.timed("put", () -> cache.put(key, data));
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MicrometerMetricsAdapter {

	static final String PREFIX = "memory.cache";
	static final String OPERATION_TIMER = PREFIX + ".operation.duration";

	private final SBMemoryCache cache;  // Gauge/FunctionCounter는 약한 참조만 가지므로 여기서 강한 참조 유지
	private final MeterRegistry meterRegistry;
	private final String cacheName;

	/**
	 * Micrometer 어댑터 생성
	 *
	 * @param cache 대상 캐시
	 * @param meterRegistry Micrometer 레지스트리
	 * @param cacheName 캐시 이름 (태그로 사용)
	 */
	public MicrometerMetricsAdapter(
		SBMemoryCache cache,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		if (cache == null) {
			throw new IllegalArgumentException("Cache must not be null");
		}
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}

		this.cache = cache;
		this.meterRegistry = meterRegistry;
		this.cacheName = cacheName;

		// Gauge 등록 (실시간 값)
		Gauge.builder(PREFIX + ".size", cache, c -> c.size())
			.tag("cache", cacheName)
			.description("Current number of entries")
			.register(meterRegistry);

		Gauge.builder(PREFIX + ".capacity", cache, c -> c.capacity())
			.tag("cache", cacheName)
			.description("Maximum number of entries")
			.register(meterRegistry);

		Gauge.builder(PREFIX + ".hit.rate", cache, c -> c.stats().hitRatePercent())
			.tag("cache", cacheName)
			.description("Hit rate in percent")
			.register(meterRegistry);

		// 누적 카운터
		FunctionCounter.builder(PREFIX + ".hits", cache, c -> c.stats().hitCount())
			.tag("cache", cacheName)
			.description("Cache hit count")
			.register(meterRegistry);

		FunctionCounter.builder(PREFIX + ".misses", cache, c -> c.stats().missCount())
			.tag("cache", cacheName)
			.description("Cache miss count")
			.register(meterRegistry);

		FunctionCounter.builder(PREFIX + ".evictions", cache, c -> c.stats().evictionCount())
			.tag("cache", cacheName)
			.description("Entries evicted due to capacity")
			.register(meterRegistry);

		FunctionCounter.builder(PREFIX + ".expirations", cache, c -> c.stats().expirationCount())
			.tag("cache", cacheName)
			.description("Entries removed because their TTL elapsed")
			.register(meterRegistry);
	}

	/**
	 * 작업 시간을 측정하고 결과를 그대로 반환합니다.
	 * 작업이 예외를 던져도 시간은 기록되고 예외는 그대로 전달됩니다.
	 *
	 * @param operation 작업 이름 (operation 태그)
	 * @param action 측정할 작업
	 * @param <T> 결과 타입
	 * @return 작업 결과
	 */
	public <T> T timed(String operation, Supplier<T> action) {
		return timer(operation).record(action);
	}

	/**
	 * 반환값이 없는 작업의 시간을 측정합니다.
	 *
	 * @param operation 작업 이름 (operation 태그)
	 * @param action 측정할 작업
	 */
	public void timed(String operation, Runnable action) {
		timer(operation).record(action);
	}

	private Timer timer(String operation) {
		if (operation == null || operation.trim().isEmpty()) {
			throw new IllegalArgumentException("Operation must not be null or empty");
		}
		return Timer.builder(OPERATION_TIMER)
			.tag("cache", cacheName)
			.tag("operation", operation)
			.description("Cache operation duration")
			.register(meterRegistry);
	}

	/**
	 * 캐시 이름을 반환합니다.
	 *
	 * @return 캐시 이름
	 */
	public String getCacheName() {
		return cacheName;
	}
}
