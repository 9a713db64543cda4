package org.scriptonbasestar.memorycache.core.exception;

/**
 * 캐시 내용을 진단용으로 직렬화하지 못했을 때 발생합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBCacheExportException extends RuntimeException {

	public SBCacheExportException(String message, Throwable cause) {
		super(message, cause);
	}
}
