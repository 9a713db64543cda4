package org.scriptonbasestar.memorycache.spring.boot;

import org.scriptonbasestar.memorycache.collection.jmx.JmxHelper;
import org.scriptonbasestar.memorycache.collection.map.MemoryCacheConfig;
import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;
import org.scriptonbasestar.memorycache.spring.actuator.MemoryCacheHealthIndicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot Auto-Configuration for SB Memory Cache.
 * <p>
 * Provides a single {@link SBMemoryCache} bean built from {@code sb-memory-cache.*} properties.
 * The bean is independent of {@code SharedMemoryCache}; inject it rather than using the shared holder.
 * </p>
 *
 * <h3>Optional beans:</h3>
 * <ul>
 *   <li>{@code sb-memory-cache.enable-jmx=true}: MBean registration, removed on shutdown</li>
 *   <li>Actuator on the classpath: a {@link MemoryCacheHealthIndicator}</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
@Configuration
@ConditionalOnClass(SBMemoryCache.class)
@EnableConfigurationProperties(SBMemoryCacheProperties.class)
public class SBMemoryCacheAutoConfiguration {

	private static final Logger log = LoggerFactory.getLogger(SBMemoryCacheAutoConfiguration.class);

	private final SBMemoryCacheProperties properties;

	@Autowired
	public SBMemoryCacheAutoConfiguration(SBMemoryCacheProperties properties) {
		this.properties = properties;
	}

	/**
	 * Creates the cache if none is already defined.
	 *
	 * @return configured SBMemoryCache
	 */
	@Bean
	@ConditionalOnMissingBean
	public SBMemoryCache sbMemoryCache() {
		MemoryCacheConfig config = new MemoryCacheConfig(properties.getCapacity(), properties.getDefaultTtl());
		log.info("Creating SBMemoryCache '{}' with {}", properties.getCacheName(), config);
		return new SBMemoryCache(config);
	}

	/**
	 * Registers the statistics MBean for the cache.
	 *
	 * @param cache the cache to expose
	 * @return registration handle, unregistered on shutdown
	 */
	@Bean
	@ConditionalOnProperty(prefix = "sb-memory-cache", name = "enable-jmx", havingValue = "true")
	public JmxRegistration sbMemoryCacheJmxRegistration(SBMemoryCache cache) {
		JmxHelper.registerCache(cache, properties.getCacheName());
		return new JmxRegistration(properties.getCacheName());
	}

	/**
	 * Health indicator, only when Spring Boot Actuator is on the classpath.
	 */
	@Configuration
	@ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
	static class HealthIndicatorConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "sbMemoryCacheHealthIndicator")
		public HealthIndicator sbMemoryCacheHealthIndicator(SBMemoryCache cache, SBMemoryCacheProperties properties) {
			return new MemoryCacheHealthIndicator(properties.getCacheName(), cache);
		}
	}

	/**
	 * Unregisters the MBean when the context closes.
	 */
	public static class JmxRegistration implements DisposableBean {
		private final String cacheName;

		JmxRegistration(String cacheName) {
			this.cacheName = cacheName;
		}

		public String getCacheName() {
			return cacheName;
		}

		@Override
		public void destroy() {
			JmxHelper.unregisterCache(cacheName);
		}
	}
}
