package org.scriptonbasestar.memorycache.collection.jmx;

import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;
import org.scriptonbasestar.memorycache.collection.metrics.CacheStats;

import java.time.Duration;

/**
 * Default implementation of {@link CacheStatisticsMXBean}.
 * <p>
 * Every attribute read takes a fresh {@link CacheStats} snapshot from the cache.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheStatistics implements CacheStatisticsMXBean {

	private final SBMemoryCache cache;
	private final String cacheName;

	/**
	 * @param cache      the cache to expose
	 * @param cacheName  the cache name for identification
	 * @throws IllegalArgumentException if cache or cacheName is null/empty
	 */
	public CacheStatistics(SBMemoryCache cache, String cacheName) {
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("cacheName must not be null or empty");
		}
		this.cache = cache;
		this.cacheName = cacheName;
	}

	@Override
	public String getCacheName() {
		return cacheName;
	}

	@Override
	public int getCurrentSize() {
		return cache.size();
	}

	@Override
	public int getCapacity() {
		return cache.capacity();
	}

	@Override
	public double getFillPercent() {
		return cache.stats().fillPercent();
	}

	@Override
	public long getRequestCount() {
		return cache.stats().requestCount();
	}

	@Override
	public long getHitCount() {
		return cache.stats().hitCount();
	}

	@Override
	public long getMissCount() {
		return cache.stats().missCount();
	}

	@Override
	public double getHitRatePercent() {
		return cache.stats().hitRatePercent();
	}

	@Override
	public long getEvictionCount() {
		return cache.stats().evictionCount();
	}

	@Override
	public long getExpirationCount() {
		return cache.stats().expirationCount();
	}

	@Override
	public long getDefaultTtlSeconds() {
		Duration ttl = cache.defaultTtl();
		return ttl == null ? -1 : ttl.getSeconds();
	}

	@Override
	public int cleanupExpired() {
		return cache.cleanupExpired();
	}

	@Override
	public void clearAll() {
		cache.clearAll();
	}

	@Override
	public String getStatisticsSummary() {
		CacheStats stats = cache.stats();
		StringBuilder sb = new StringBuilder();
		sb.append("Cache Statistics for '").append(cacheName).append("':\n");
		sb.append("  Requests: ").append(stats.requestCount()).append("\n");
		sb.append("  Hits: ").append(stats.hitCount()).append(" (").append(String.format("%.2f", stats.hitRatePercent())).append("%)\n");
		sb.append("  Misses: ").append(stats.missCount()).append("\n");
		sb.append("  Evictions: ").append(stats.evictionCount()).append("\n");
		sb.append("  Expirations: ").append(stats.expirationCount()).append("\n");
		sb.append("  Current Size: ").append(stats.size())
			.append(" / ").append(stats.capacity())
			.append(" (").append(String.format("%.1f", stats.fillPercent())).append("%)\n");
		return sb.toString();
	}

	@Override
	public String toString() {
		return "CacheStatistics{" +
			"cacheName='" + cacheName + '\'' +
			", " + cache.stats() +
			'}';
	}
}
