package org.scriptonbasestar.memorycache.core.key;

import java.util.Objects;

/**
 * 캐시 항목을 식별하는 복합 키 (owner, category, subKey)
 *
 * 세 필드의 구조적 동등성으로 비교합니다. 문자열을 이어 붙인 키와 달리
 * 구분자 문자가 값 안에 들어 있어도 서로 다른 키가 충돌하지 않습니다.
 *
 * <pre>{@code
 * MemoryKey key = MemoryKey.of("langgraph_agent", "decision", "healing_strategy");
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public final class MemoryKey {

	private final String owner;
	private final String category;
	private final String subKey;

	public MemoryKey(String owner, String category, String subKey) {
		this.owner = requireText(owner, "owner");
		this.category = requireText(category, "category");
		this.subKey = requireText(subKey, "subKey");
	}

	public static MemoryKey of(String owner, String category, String subKey) {
		return new MemoryKey(owner, category, subKey);
	}

	public String owner() {
		return owner;
	}

	public String category() {
		return category;
	}

	public String subKey() {
		return subKey;
	}

	/**
	 * owner 필드가 정확히 일치하는지 확인합니다. 접두사 비교가 아닙니다.
	 *
	 * @param owner 비교할 owner
	 * @return 일치하면 true
	 */
	public boolean isOwnedBy(String owner) {
		return this.owner.equals(owner);
	}

	private static String requireText(String value, String name) {
		if (value == null || value.isEmpty()) {
			throw new IllegalArgumentException(name + " must not be null or empty");
		}
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof MemoryKey)) return false;
		MemoryKey that = (MemoryKey) o;
		return owner.equals(that.owner) && category.equals(that.category) && subKey.equals(that.subKey);
	}

	@Override
	public int hashCode() {
		return Objects.hash(owner, category, subKey);
	}

	/**
	 * 로그 및 진단용 표현. 조회 키로 사용하지 않습니다.
	 */
	@Override
	public String toString() {
		return owner + ":" + category + ":" + subKey;
	}
}
