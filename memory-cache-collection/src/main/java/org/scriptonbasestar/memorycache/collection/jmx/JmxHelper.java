package org.scriptonbasestar.memorycache.collection.jmx;

import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;

/**
 * Helper class for JMX MBean registration and management.
 *
 * <h3>ObjectName Pattern:</h3>
 * <pre>
 * org.scriptonbasestar.memorycache:type=SBMemoryCache,name={cacheName}
 * </pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public final class JmxHelper {

	private static final Logger log = LoggerFactory.getLogger(JmxHelper.class);

	private static final String DOMAIN = "org.scriptonbasestar.memorycache";
	private static final String TYPE = "SBMemoryCache";

	private JmxHelper() {
		// Utility class
	}

	/**
	 * Registers a cache with the platform MBeanServer.
	 * <p>
	 * An existing registration under the same name is replaced.
	 * </p>
	 *
	 * @param cache      the cache to expose
	 * @param cacheName  the cache name (used in ObjectName)
	 * @return the registered CacheStatistics instance
	 * @throws IllegalArgumentException if cache or cacheName is null/empty
	 * @throws JmxRegistrationException if registration fails
	 */
	public static CacheStatistics registerCache(SBMemoryCache cache, String cacheName) {
		CacheStatistics mbean = new CacheStatistics(cache, cacheName);

		try {
			MBeanServer mbs = ManagementFactory.getPlatformMBeanServer();
			ObjectName objectName = createObjectName(cacheName);

			if (mbs.isRegistered(objectName)) {
				mbs.unregisterMBean(objectName);
			}

			mbs.registerMBean(mbean, objectName);
			log.info("Registered JMX MBean: {}", objectName);
			return mbean;

		} catch (JMException e) {
			throw new JmxRegistrationException("Failed to register JMX MBean for cache: " + cacheName, e);
		}
	}

	/**
	 * Unregisters a cache from JMX.
	 * <p>
	 * Safe to call even if the cache is not registered. Failures are logged, not thrown.
	 * </p>
	 *
	 * @param cacheName the cache name to unregister
	 */
	public static void unregisterCache(String cacheName) {
		if (cacheName == null || cacheName.trim().isEmpty()) {
			return;
		}

		try {
			MBeanServer mbs = ManagementFactory.getPlatformMBeanServer();
			ObjectName objectName = createObjectName(cacheName);

			if (mbs.isRegistered(objectName)) {
				mbs.unregisterMBean(objectName);
				log.info("Unregistered JMX MBean: {}", objectName);
			}
		} catch (JMException e) {
			log.warn("Failed to unregister JMX MBean for cache: {}", cacheName, e);
		}
	}

	/**
	 * Checks if a cache is registered with JMX.
	 *
	 * @param cacheName the cache name to check
	 * @return true if registered, false otherwise
	 */
	public static boolean isRegistered(String cacheName) {
		if (cacheName == null || cacheName.trim().isEmpty()) {
			return false;
		}

		try {
			return ManagementFactory.getPlatformMBeanServer().isRegistered(createObjectName(cacheName));
		} catch (MalformedObjectNameException e) {
			return false;
		}
	}

	/**
	 * Creates a standardized ObjectName for a cache.
	 *
	 * @param cacheName the cache name
	 * @return the ObjectName
	 * @throws MalformedObjectNameException if the name is invalid
	 */
	public static ObjectName createObjectName(String cacheName) throws MalformedObjectNameException {
		// Sanitize cache name for ObjectName (replace invalid characters)
		String safeName = cacheName.replaceAll("[,=:\"\\*\\?]", "_");
		return new ObjectName(DOMAIN + ":type=" + TYPE + ",name=" + safeName);
	}

	/**
	 * Exception thrown when JMX registration fails.
	 */
	public static class JmxRegistrationException extends RuntimeException {
		public JmxRegistrationException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
