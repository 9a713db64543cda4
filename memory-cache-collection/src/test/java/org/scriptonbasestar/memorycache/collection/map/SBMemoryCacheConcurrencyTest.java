package org.scriptonbasestar.memorycache.collection.map;

import org.junit.After;
import org.junit.Test;
import org.scriptonbasestar.memorycache.collection.metrics.CacheStats;
import org.scriptonbasestar.memorycache.core.key.MemoryKey;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

/**
 * 멀티쓰레드 환경에서 capacity 불변식과 카운터 정합성 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBMemoryCacheConcurrencyTest {

	private ExecutorService executor;

	@After
	public void tearDown() {
		if (executor != null) {
			executor.shutdownNow();
		}
	}

	@Test
	public void test멀티쓰레드환경에서_capacity와_요청수_유지() throws Exception {
		// Given
		int threadCount = 16;
		int opsPerThread = 2_000;
		int capacity = 50;
		SBMemoryCache cache = SBMemoryCache.builder()
			.capacity(capacity)
			.defaultTtl(Duration.ofMinutes(10))
			.build();
		executor = Executors.newFixedThreadPool(threadCount);
		CountDownLatch startGate = new CountDownLatch(1);
		AtomicLong gets = new AtomicLong();
		AtomicLong sizeViolations = new AtomicLong();

		Callable<Void> worker = () -> {
			startGate.await();
			ThreadLocalRandom random = ThreadLocalRandom.current();
			for (int i = 0; i < opsPerThread; i++) {
				MemoryKey key = MemoryKey.of("owner" + random.nextInt(4), "cat", "k" + random.nextInt(200));
				switch (random.nextInt(6)) {
					case 0:
					case 1:
						cache.put(key, Collections.singletonMap("v", i));
						break;
					case 2:
					case 3:
						cache.get(key);
						gets.incrementAndGet();
						break;
					case 4:
						cache.remove(key);
						break;
					default:
						cache.getAllEntries(key.owner());
						break;
				}
				if (cache.size() > capacity) {
					sizeViolations.incrementAndGet();
				}
			}
			return null;
		};

		// When
		List<Future<Void>> futures = new ArrayList<>();
		for (int i = 0; i < threadCount; i++) {
			futures.add(executor.submit(worker));
		}
		startGate.countDown();
		for (Future<Void> future : futures) {
			future.get(30, TimeUnit.SECONDS);
		}

		// Then
		CacheStats stats = cache.stats();
		assertEquals(0, sizeViolations.get());
		assertTrue(stats.size() <= capacity);
		assertEquals(gets.get(), stats.requestCount());
	}

	@Test
	public void test동시에_같은키_갱신() throws Exception {
		// Given
		SBMemoryCache cache = SBMemoryCache.builder().capacity(10).build();
		MemoryKey key = MemoryKey.of("agent", "decision", "strategy");
		executor = Executors.newFixedThreadPool(8);

		// When
		List<Future<?>> futures = new ArrayList<>();
		for (int i = 0; i < 100; i++) {
			int value = i;
			futures.add(executor.submit(() -> {
				cache.put(key, Collections.singletonMap("v", value));
				Map<String, Object> read = cache.get(key);
				assertNotNull(read);
			}));
		}
		for (Future<?> future : futures) {
			future.get(10, TimeUnit.SECONDS);
		}

		// Then
		assertEquals(1, cache.size());
		assertEquals(100, cache.stats().hitCount());
		assertEquals(0, cache.stats().missCount());
	}
}
