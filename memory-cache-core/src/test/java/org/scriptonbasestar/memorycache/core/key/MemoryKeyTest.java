package org.scriptonbasestar.memorycache.core.key;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * MemoryKey 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoryKeyTest {

	@Test
	public void testStructuralEquality() {
		MemoryKey a = MemoryKey.of("a1", "pref", "k1");
		MemoryKey b = new MemoryKey("a1", "pref", "k1");

		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, MemoryKey.of("a1", "pref", "k2"));
		assertNotEquals(a, MemoryKey.of("a2", "pref", "k1"));
	}

	@Test
	public void testSeparatorInsideComponentDoesNotCollide() {
		// Given - 문자열로 이으면 "a:b:c:d"로 같아지는 두 키
		MemoryKey first = MemoryKey.of("a:b", "c", "d");
		MemoryKey second = MemoryKey.of("a", "b:c", "d");

		// Then
		assertEquals(first.toString(), second.toString());
		assertNotEquals(first, second);

		Set<MemoryKey> keys = new HashSet<>();
		keys.add(first);
		keys.add(second);
		assertEquals(2, keys.size());
	}

	@Test
	public void testIsOwnedByIsExactMatch() {
		MemoryKey key = MemoryKey.of("xy", "pref", "k1");

		assertTrue(key.isOwnedBy("xy"));
		assertFalse(key.isOwnedBy("x"));
		assertFalse(key.isOwnedBy(null));
	}

	@Test
	public void testAccessors() {
		MemoryKey key = MemoryKey.of("agent", "decision", "strategy");

		assertEquals("agent", key.owner());
		assertEquals("decision", key.category());
		assertEquals("strategy", key.subKey());
		assertEquals("agent:decision:strategy", key.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullOwnerRejected() {
		MemoryKey.of(null, "pref", "k1");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyCategoryRejected() {
		MemoryKey.of("a1", "", "k1");
	}

	@Test
	public void testWhitespaceSubKeyAccepted() {
		// 빈 문자열만 거부하고 공백 문자열은 그대로 키로 사용
		MemoryKey key = MemoryKey.of("a1", "pref", "   ");

		assertEquals("   ", key.subKey());
		assertNotEquals(MemoryKey.of("a1", "pref", " "), key);
	}
}
