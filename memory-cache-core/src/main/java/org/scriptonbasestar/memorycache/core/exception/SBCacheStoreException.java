package org.scriptonbasestar.memorycache.core.exception;

/**
 * 저장소에 레코드를 기록하지 못했을 때 발생합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBCacheStoreException extends RuntimeException {

	public SBCacheStoreException(String message) {
		super(message);
	}

	public SBCacheStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
