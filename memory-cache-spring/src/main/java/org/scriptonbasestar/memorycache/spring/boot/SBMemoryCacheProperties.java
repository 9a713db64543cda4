package org.scriptonbasestar.memorycache.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for SB Memory Cache.
 * <p>
 * Bind to {@code sb-memory-cache.*} properties in application.yml/properties.
 * </p>
 *
 * <h3>Example Configuration:</h3>
 * <pre>{@code
 * # application.yml
 * sb-memory-cache:
 *   capacity: 1000
 *   default-ttl: 1h
 *   cache-name: agent-memory
 *   enable-jmx: true
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
@ConfigurationProperties(prefix = "sb-memory-cache")
public class SBMemoryCacheProperties {

	/**
	 * Maximum number of entries.
	 */
	private int capacity = 1000;

	/**
	 * Default TTL for entries stored without one. Zero disables expiry.
	 */
	private Duration defaultTtl = Duration.ofHours(1);

	/**
	 * Name used for JMX registration and health/metrics reporting.
	 */
	private String cacheName = "agent-memory";

	/**
	 * Register the cache statistics MBean.
	 */
	private boolean enableJmx = false;

	public int getCapacity() {
		return capacity;
	}

	public void setCapacity(int capacity) {
		this.capacity = capacity;
	}

	public Duration getDefaultTtl() {
		return defaultTtl;
	}

	public void setDefaultTtl(Duration defaultTtl) {
		this.defaultTtl = defaultTtl;
	}

	public String getCacheName() {
		return cacheName;
	}

	public void setCacheName(String cacheName) {
		this.cacheName = cacheName;
	}

	public boolean isEnableJmx() {
		return enableJmx;
	}

	public void setEnableJmx(boolean enableJmx) {
		this.enableJmx = enableJmx;
	}
}
