package org.scriptonbasestar.memorycache.collection.map;

import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * MemoryCacheEntry 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoryCacheEntryTest {

	private final Instant createdAt = Instant.parse("2025-01-01T00:00:00Z");

	@Test
	public void testExpiry() {
		MemoryCacheEntry entry = new MemoryCacheEntry(Collections.singletonMap("v", 1), createdAt, Duration.ofSeconds(1));

		assertFalse(entry.isExpired(createdAt.plusMillis(500)));
		assertFalse(entry.isExpired(createdAt.plusSeconds(1)));
		assertTrue(entry.isExpired(createdAt.plusMillis(1500)));
	}

	@Test
	public void testNoTtl() {
		MemoryCacheEntry entry = new MemoryCacheEntry(Collections.singletonMap("v", 1), createdAt, null);

		assertFalse(entry.isExpired(createdAt.plus(Duration.ofDays(1000))));
		assertNull(entry.ttl());
	}

	@Test
	public void testTouch() {
		MemoryCacheEntry entry = new MemoryCacheEntry(Collections.emptyMap(), createdAt, null);
		assertEquals(0, entry.accessCount());

		entry.touch();
		entry.touch();

		assertEquals(2, entry.accessCount());
		assertEquals(createdAt, entry.createdAt());
	}
}
