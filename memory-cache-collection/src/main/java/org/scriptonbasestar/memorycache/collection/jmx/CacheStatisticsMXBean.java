package org.scriptonbasestar.memorycache.collection.jmx;

/**
 * JMX MBean interface for memory cache monitoring.
 * <p>
 * Exposes a live view of an {@code SBMemoryCache} for JConsole or VisualVM.
 * Reading attributes never touches recency order or hit/miss counters.
 * </p>
 *
 * <pre>{@code
 * CacheStatistics mbean = JmxHelper.registerCache(cache, "agent-memory");
 * // MBeans -> org.scriptonbasestar.memorycache -> SBMemoryCache -> agent-memory
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public interface CacheStatisticsMXBean {

	String getCacheName();

	int getCurrentSize();

	int getCapacity();

	/**
	 * Gets the cache fill percentage (0-100).
	 *
	 * @return fill percentage
	 */
	double getFillPercent();

	long getRequestCount();

	long getHitCount();

	long getMissCount();

	/**
	 * Gets the cache hit rate as a percentage (0-100).
	 *
	 * @return hit rate percentage, 0 when there were no requests
	 */
	double getHitRatePercent();

	long getEvictionCount();

	long getExpirationCount();

	/**
	 * Gets the default TTL in seconds.
	 *
	 * @return default TTL seconds, or -1 when entries do not expire by default
	 */
	long getDefaultTtlSeconds();

	// Operations

	/**
	 * Removes expired entries now.
	 *
	 * @return number of removed entries
	 */
	int cleanupExpired();

	/**
	 * Removes all entries and resets statistics.
	 */
	void clearAll();

	/**
	 * Gets a summary of cache statistics as a formatted string.
	 *
	 * @return statistics summary
	 */
	String getStatisticsSummary();
}
