package org.scriptonbasestar.memorycache.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * @athor archmagece
 * @since 2017-01-17 16
 */
@Slf4j
@UtilityClass
public class TimeCheckerUtil {

	/**
	 * 생성 시각과 TTL 기준으로 만료 여부를 확인합니다.
	 * 경과 시간이 TTL을 초과해야 만료입니다 (같으면 아직 유효).
	 *
	 * @param createdAt 생성 시각
	 * @param ttl TTL, null이면 만료되지 않음
	 * @param now 기준 시각
	 * @return 만료되었으면 true
	 */
	public static boolean isExpired(Instant createdAt, Duration ttl, Instant now) {
		if (ttl == null) {
			return false;
		}
		Duration age = Duration.between(createdAt, now);

		if (log.isTraceEnabled()) {
			log.trace("isExpired param - createdAt : {}, ttl : {}, now : {}", createdAt, ttl, now);
			log.trace("isExpired 비교 - age : {}, ttl : {}", age, ttl);
		}

		return age.compareTo(ttl) > 0;
	}

	/**
	 * TTL 값을 검증합니다. 음수는 허용하지 않습니다.
	 *
	 * @param ttl 검증할 TTL (null 허용)
	 * @param name 오류 메시지에 쓸 이름
	 * @return 전달받은 ttl
	 */
	public static Duration requireNonNegative(Duration ttl, String name) {
		if (ttl != null && ttl.isNegative()) {
			throw new IllegalArgumentException(name + " must not be negative: " + ttl);
		}
		return ttl;
	}
}
