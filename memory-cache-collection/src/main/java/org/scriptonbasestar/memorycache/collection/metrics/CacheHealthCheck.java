package org.scriptonbasestar.memorycache.collection.metrics;

/**
 * 캐시 헬스체크 유틸리티
 *
 * 통계 스냅샷을 임계값과 비교해 캐시의 건강 상태를 평가합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheHealthCheck {

	private final HealthThresholds thresholds;

	/**
	 * 기본 임계값으로 헬스체크 생성
	 */
	public CacheHealthCheck() {
		this(HealthThresholds.DEFAULT);
	}

	/**
	 * 커스텀 임계값으로 헬스체크 생성
	 *
	 * @param thresholds 건강 임계값
	 */
	public CacheHealthCheck(HealthThresholds thresholds) {
		if (thresholds == null) {
			throw new IllegalArgumentException("Thresholds must not be null");
		}
		this.thresholds = thresholds;
	}

	/**
	 * 캐시의 전반적인 건강 상태를 확인합니다.
	 *
	 * @param stats 통계 스냅샷
	 * @return 건강 상태 결과
	 */
	public HealthStatus check(CacheStats stats) {
		if (stats == null) {
			throw new IllegalArgumentException("Stats must not be null");
		}
		HealthStatus.Builder builder = new HealthStatus.Builder();

		// capacity 불변식 위반
		if (stats.size() > stats.capacity()) {
			builder.addError(String.format(
				"Size exceeds capacity: %d > %d", stats.size(), stats.capacity()
			));
		}

		// 요청 수가 적으면 히트율은 판단하지 않음
		long requests = stats.requestCount();
		if (requests < thresholds.minRequests) {
			builder.addInfo(String.format(
				"Low request count: %d (threshold: %d)",
				requests, thresholds.minRequests
			));
		} else if (stats.hitRatePercent() < thresholds.minHitRatePercent) {
			builder.addWarning(String.format(
				"Low hit rate: %.2f%% (threshold: %.2f%%)",
				stats.hitRatePercent(), thresholds.minHitRatePercent
			));
		}

		// 사용률 검사
		if (stats.fillPercent() > thresholds.maxFillPercent) {
			builder.addWarning(String.format(
				"High fill: %.2f%% (threshold: %.2f%%)",
				stats.fillPercent(), thresholds.maxFillPercent
			));
		}

		return builder.build();
	}

	/**
	 * 건강 임계값 설정
	 */
	public static class HealthThresholds {

		/**
		 * 기본 임계값
		 */
		public static final HealthThresholds DEFAULT = new HealthThresholds(
			50.0,   // minHitRatePercent
			100.0,  // maxFillPercent (가득 찬 것은 정상, 초과만 에러)
			10      // minRequests
		);

		/**
		 * 엄격한 임계값
		 */
		public static final HealthThresholds STRICT = new HealthThresholds(
			80.0,
			90.0,
			100
		);

		public final double minHitRatePercent;
		public final double maxFillPercent;
		public final long minRequests;

		public HealthThresholds(double minHitRatePercent, double maxFillPercent, long minRequests) {
			this.minHitRatePercent = minHitRatePercent;
			this.maxFillPercent = maxFillPercent;
			this.minRequests = minRequests;
		}
	}

	/**
	 * 건강 상태 결과
	 */
	public static class HealthStatus {

		private final boolean healthy;
		private final String[] errors;
		private final String[] warnings;
		private final String[] info;

		private HealthStatus(boolean healthy, String[] errors, String[] warnings, String[] info) {
			this.healthy = healthy;
			this.errors = errors;
			this.warnings = warnings;
			this.info = info;
		}

		/**
		 * 에러가 없으면 true
		 */
		public boolean isHealthy() {
			return healthy;
		}

		public String[] errors() {
			return errors.clone();
		}

		public String[] warnings() {
			return warnings.clone();
		}

		public String[] info() {
			return info.clone();
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder();
			sb.append("HealthStatus{healthy=").append(healthy);
			if (errors.length > 0) {
				sb.append(", errors=").append(java.util.Arrays.toString(errors));
			}
			if (warnings.length > 0) {
				sb.append(", warnings=").append(java.util.Arrays.toString(warnings));
			}
			if (info.length > 0) {
				sb.append(", info=").append(java.util.Arrays.toString(info));
			}
			sb.append("}");
			return sb.toString();
		}

		static class Builder {
			private final java.util.List<String> errors = new java.util.ArrayList<>();
			private final java.util.List<String> warnings = new java.util.ArrayList<>();
			private final java.util.List<String> info = new java.util.ArrayList<>();

			Builder addError(String message) {
				errors.add(message);
				return this;
			}

			Builder addWarning(String message) {
				warnings.add(message);
				return this;
			}

			Builder addInfo(String message) {
				info.add(message);
				return this;
			}

			HealthStatus build() {
				return new HealthStatus(
					errors.isEmpty(),
					errors.toArray(new String[0]),
					warnings.toArray(new String[0]),
					info.toArray(new String[0])
				);
			}
		}
	}
}
