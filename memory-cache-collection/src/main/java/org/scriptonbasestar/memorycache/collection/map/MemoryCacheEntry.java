package org.scriptonbasestar.memorycache.collection.map;

import org.scriptonbasestar.memorycache.core.util.TimeCheckerUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 캐시 항목. SBMemoryCache 내부에서만 사용하며 외부로 노출하지 않습니다.
 * 모든 접근은 SBMemoryCache의 락 안에서 일어납니다.
 *
 * @author archmagece
 * @since 2025-01
 */
final class MemoryCacheEntry {

	private final Map<String, Object> data;
	private final Instant createdAt;
	private final Duration ttl;  // null이면 만료 없음
	private long accessCount;

	MemoryCacheEntry(Map<String, Object> data, Instant createdAt, Duration ttl) {
		// 최상위 맵만 복사, 중첩 값은 공유됨
		this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
		this.createdAt = createdAt;
		this.ttl = ttl;
	}

	boolean isExpired(Instant now) {
		return TimeCheckerUtil.isExpired(createdAt, ttl, now);
	}

	void touch() {
		accessCount++;
	}

	Map<String, Object> data() {
		return data;
	}

	Instant createdAt() {
		return createdAt;
	}

	Duration ttl() {
		return ttl;
	}

	long accessCount() {
		return accessCount;
	}
}
