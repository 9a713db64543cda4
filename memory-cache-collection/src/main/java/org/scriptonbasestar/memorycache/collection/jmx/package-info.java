/**
 * JMX 모니터링 지원
 *
 * <p>{@link org.scriptonbasestar.memorycache.collection.jmx.JmxHelper}로 등록하면
 * JConsole/VisualVM에서 크기, 히트율, 축출/만료 횟수를 볼 수 있고
 * cleanupExpired, clearAll 작업을 실행할 수 있습니다.</p>
 *
 * @since 2025-01
 * @author archmagece
 */
package org.scriptonbasestar.memorycache.collection.jmx;
