/**
 * Micrometer 연동
 *
 * SBMemoryCache의 통계를 MeterRegistry에 게이지/FunctionCounter로 노출하고,
 * 호출 시간을 명시적으로 측정하는 timed 래퍼를 제공합니다.
 *
 * <pre>{@code
 * MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(cache, registry, "agent-memory");
 * Map<String, Object> memory = adapter.timed("get", () -> cache.get(key));
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.memorycache.metrics.micrometer;
