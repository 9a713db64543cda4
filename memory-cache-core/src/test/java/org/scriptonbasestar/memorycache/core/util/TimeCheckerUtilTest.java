package org.scriptonbasestar.memorycache.core.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * @athor archmagece
 * @since 2017-01-17 16
 */
public class TimeCheckerUtilTest {

	private final Instant createdAt = Instant.parse("2025-01-01T00:00:00Z");

	@Before
	public void before(){
		Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		root.setLevel(Level.ALL);
	}

	@Test
	public void isExpiredWithinTtl(){
		Assert.assertFalse(TimeCheckerUtil.isExpired(createdAt, Duration.ofSeconds(10), createdAt));
		Assert.assertFalse(TimeCheckerUtil.isExpired(createdAt, Duration.ofSeconds(10), createdAt.plusSeconds(5)));
		Assert.assertFalse(TimeCheckerUtil.isExpired(createdAt, Duration.ofSeconds(10), createdAt.plusMillis(9_999)));
	}

	@Test
	public void isExpiredBoundaryIsStrict(){
		//정확히 ttl만큼 지난 시점은 아직 유효
		Assert.assertFalse(TimeCheckerUtil.isExpired(createdAt, Duration.ofSeconds(10), createdAt.plusSeconds(10)));
		Assert.assertTrue(TimeCheckerUtil.isExpired(createdAt, Duration.ofSeconds(10), createdAt.plusMillis(10_001)));
	}

	@Test
	public void isExpiredNullTtlNeverExpires(){
		Assert.assertFalse(TimeCheckerUtil.isExpired(createdAt, null, createdAt.plus(Duration.ofDays(3650))));
	}

	@Test
	public void requireNonNegative(){
		Assert.assertNull(TimeCheckerUtil.requireNonNegative(null, "ttl"));
		Assert.assertEquals(Duration.ZERO, TimeCheckerUtil.requireNonNegative(Duration.ZERO, "ttl"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void requireNonNegativeRejectsNegative(){
		TimeCheckerUtil.requireNonNegative(Duration.ofSeconds(-1), "ttl");
	}
}
