package org.scriptonbasestar.memorycache.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;
import org.scriptonbasestar.memorycache.core.key.MemoryKey;

import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * MicrometerMetricsAdapter 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class MicrometerMetricsAdapterTest {

	private SBMemoryCache cache;
	private MeterRegistry meterRegistry;
	private MicrometerMetricsAdapter adapter;

	@Before
	public void setUp() {
		cache = SBMemoryCache.builder().capacity(2).build();
		meterRegistry = new SimpleMeterRegistry();
		adapter = new MicrometerMetricsAdapter(cache, meterRegistry, "test-cache");
	}

	private double gauge(String name) {
		return meterRegistry.get(name).tag("cache", "test-cache").gauge().value();
	}

	private double functionCounter(String name) {
		return meterRegistry.get(name).tag("cache", "test-cache").functionCounter().count();
	}

	@Test
	public void testGaugesFollowCache() {
		// Given
		MemoryKey key = MemoryKey.of("a", "b", "c");
		cache.put(key, Collections.singletonMap("v", 1));
		cache.get(key);
		cache.get(key);
		cache.get(key);
		cache.get(MemoryKey.of("a", "b", "missing"));

		// Then
		assertEquals(1.0, gauge("memory.cache.size"), 0.001);
		assertEquals(2.0, gauge("memory.cache.capacity"), 0.001);
		assertEquals(75.0, gauge("memory.cache.hit.rate"), 0.001);
		assertEquals(3.0, functionCounter("memory.cache.hits"), 0.001);
		assertEquals(1.0, functionCounter("memory.cache.misses"), 0.001);
	}

	@Test
	public void testEvictionCounter() {
		// When
		cache.put("a", "b", "1", Collections.singletonMap("v", 1));
		cache.put("a", "b", "2", Collections.singletonMap("v", 2));
		cache.put("a", "b", "3", Collections.singletonMap("v", 3));

		// Then
		assertEquals(1.0, functionCounter("memory.cache.evictions"), 0.001);
		assertEquals(0.0, functionCounter("memory.cache.expirations"), 0.001);
	}

	@Test
	public void testTimedSupplier() {
		// Given
		cache.put("a", "b", "c", Collections.singletonMap("v", 1));

		// When
		Map<String, Object> result = adapter.timed("get", () -> cache.get("a", "b", "c"));

		// Then - 결과는 그대로 전달됨
		assertEquals(Collections.singletonMap("v", 1), result);
		Timer timer = meterRegistry.get("memory.cache.operation.duration")
			.tag("cache", "test-cache")
			.tag("operation", "get")
			.timer();
		assertEquals(1, timer.count());
	}

	@Test
	public void testTimedRunnable() {
		adapter.timed("put", () -> cache.put("a", "b", "c", Collections.singletonMap("v", 1)));
		adapter.timed("put", () -> cache.put("a", "b", "d", Collections.singletonMap("v", 2)));

		assertEquals(2, cache.size());
		assertEquals(2, meterRegistry.get("memory.cache.operation.duration").tag("operation", "put").timer().count());
	}

	@Test
	public void testTimedPropagatesException() {
		try {
			adapter.timed("get", () -> cache.get(null));
			fail("exception should propagate");
		} catch (IllegalArgumentException e) {
			assertEquals(1, meterRegistry.get("memory.cache.operation.duration").tag("operation", "get").timer().count());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullCache() {
		new MicrometerMetricsAdapter(null, meterRegistry, "test-cache");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyCacheName() {
		new MicrometerMetricsAdapter(cache, meterRegistry, " ");
	}
}
