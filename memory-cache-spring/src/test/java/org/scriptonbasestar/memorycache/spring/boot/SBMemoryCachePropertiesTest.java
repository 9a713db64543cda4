package org.scriptonbasestar.memorycache.spring.boot;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * SBMemoryCacheProperties 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBMemoryCachePropertiesTest {

	private SBMemoryCacheProperties properties;

	@Before
	public void setUp() {
		properties = new SBMemoryCacheProperties();
	}

	@Test
	public void testDefaultValues() {
		// Then
		assertEquals(1000, properties.getCapacity());
		assertEquals(Duration.ofHours(1), properties.getDefaultTtl());
		assertEquals("agent-memory", properties.getCacheName());
		assertFalse(properties.isEnableJmx());
	}

	@Test
	public void testSettersAndGetters() {
		// When
		properties.setCapacity(50);
		properties.setDefaultTtl(Duration.ZERO);
		properties.setCacheName("decisions");
		properties.setEnableJmx(true);

		// Then
		assertEquals(50, properties.getCapacity());
		assertEquals(Duration.ZERO, properties.getDefaultTtl());
		assertEquals("decisions", properties.getCacheName());
		assertTrue(properties.isEnableJmx());
	}
}
