/**
 * 영속 저장소 연동 인터페이스
 *
 * <p>캐시는 저장소를 직접 호출하지 않습니다. 호출자(또는 {@code CacheAsideLoader})가
 * 미스 시 저장소에서 읽고 캐시를 채웁니다.</p>
 *
 * @since 2025-01
 * @author archmagece
 */
package org.scriptonbasestar.memorycache.core.store;
