package org.scriptonbasestar.memorycache.core.store;

import org.scriptonbasestar.memorycache.core.exception.SBCacheLoadFailException;
import org.scriptonbasestar.memorycache.core.exception.SBCacheStoreException;
import org.scriptonbasestar.memorycache.core.key.MemoryKey;

import java.util.Map;

/**
 * 캐시 뒤에 있는 영속 저장소.
 * <p>
 * 캐시 자체는 이 인터페이스를 호출하지 않습니다. 호출자가 cache-aside 패턴으로
 * 캐시 미스 시 {@link #load(MemoryKey)}를 호출하고 결과를 캐시에 넣습니다.
 * </p>
 *
 * <pre>{@code
 * public class AgentMemoryStore implements SBMemoryStore {
 *     private final JdbcTemplate jdbcTemplate;
 *
 *     @Override
 *     public Map<String, Object> load(MemoryKey key) {
 *         List<String> rows = jdbcTemplate.queryForList(
 *             "SELECT content FROM agent_memory WHERE agent_id = ? AND memory_type = ? AND memory_key = ?",
 *             String.class, key.owner(), key.category(), key.subKey());
 *         return rows.isEmpty() ? null : parse(rows.get(0));
 *     }
 *     ...
 * }
 * }</pre>
 *
 * 구현체는 여러 스레드에서 동시에 호출될 수 있으므로 thread-safe 해야 합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public interface SBMemoryStore {

	/**
	 * 레코드를 읽어옵니다.
	 *
	 * @param key 복합 키
	 * @return 레코드, 없으면 null
	 * @throws SBCacheLoadFailException 읽기 실패 시
	 */
	Map<String, Object> load(MemoryKey key) throws SBCacheLoadFailException;

	/**
	 * 레코드를 저장합니다.
	 *
	 * @param key 복합 키
	 * @param record 저장할 레코드
	 * @throws SBCacheStoreException 저장 실패 시
	 */
	void save(MemoryKey key, Map<String, Object> record) throws SBCacheStoreException;
}
