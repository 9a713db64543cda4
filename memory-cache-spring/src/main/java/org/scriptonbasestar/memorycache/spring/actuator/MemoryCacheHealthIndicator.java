package org.scriptonbasestar.memorycache.spring.actuator;

import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;
import org.scriptonbasestar.memorycache.collection.metrics.CacheHealthCheck;
import org.scriptonbasestar.memorycache.collection.metrics.CacheStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Spring Boot Actuator HealthIndicator for SB Memory Cache.
 * <p>
 * Reports DOWN only when the health check finds an error (size over capacity).
 * A low hit rate or a full cache is reported as a warning detail while staying UP.
 * </p>
 *
 * <h3>Response Format:</h3>
 * <pre>{@code
 * {
 *   "status": "UP",
 *   "details": {
 *     "cacheName": "agent-memory",
 *     "size": 420,
 *     "capacity": 1000,
 *     "hits": 850,
 *     "misses": 150,
 *     "hitRate": "85.00%",
 *     "evictions": 0,
 *     "expirations": 12
 *   }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoryCacheHealthIndicator implements HealthIndicator {

	private final String cacheName;
	private final SBMemoryCache cache;
	private final CacheHealthCheck healthCheck;

	public MemoryCacheHealthIndicator(String cacheName, SBMemoryCache cache) {
		this(cacheName, cache, CacheHealthCheck.HealthThresholds.DEFAULT);
	}

	/**
	 * Creates a new indicator with custom health thresholds.
	 *
	 * @param cacheName  the cache name for identification
	 * @param cache      the cache to monitor
	 * @param thresholds custom health thresholds
	 */
	public MemoryCacheHealthIndicator(String cacheName, SBMemoryCache cache,
									  CacheHealthCheck.HealthThresholds thresholds) {
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("cacheName must not be null or empty");
		}
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		this.cacheName = cacheName;
		this.cache = cache;
		this.healthCheck = new CacheHealthCheck(thresholds);
	}

	@Override
	public Health health() {
		CacheStats stats = cache.stats();
		CacheHealthCheck.HealthStatus status = healthCheck.check(stats);

		Health.Builder builder = status.isHealthy() ? Health.up() : Health.down();

		// 기본 통계 정보
		builder.withDetail("cacheName", cacheName);
		builder.withDetail("size", stats.size());
		builder.withDetail("capacity", stats.capacity());
		builder.withDetail("hits", stats.hitCount());
		builder.withDetail("misses", stats.missCount());
		builder.withDetail("hitRate", String.format("%.2f%%", stats.hitRatePercent()));
		builder.withDetail("evictions", stats.evictionCount());
		builder.withDetail("expirations", stats.expirationCount());

		// 경고 및 에러 정보
		if (status.warnings().length > 0) {
			builder.withDetail("warnings", status.warnings());
		}
		if (status.errors().length > 0) {
			builder.withDetail("errors", status.errors());
		}
		if (status.info().length > 0) {
			builder.withDetail("info", status.info());
		}

		return builder.build();
	}

	public String getCacheName() {
		return cacheName;
	}
}
