package org.scriptonbasestar.memorycache.core.exception;

/**
 * 저장소에서 레코드를 읽어오지 못했을 때 발생합니다.
 *
 * @author archmagece
 * @since 2016-11-06
 */
public class SBCacheLoadFailException extends RuntimeException {

	public SBCacheLoadFailException(String message) {
		super(message);
	}

	public SBCacheLoadFailException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBCacheLoadFailException(Throwable cause) {
		super(cause);
	}
}
