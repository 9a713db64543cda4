package org.scriptonbasestar.memorycache.core.exception;

/**
 * 캐시 설정 값이 잘못되었거나 공유 인스턴스 설정이 충돌할 때 발생합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBCacheConfigException extends IllegalArgumentException {

	public SBCacheConfigException(String message) {
		super(message);
	}
}
