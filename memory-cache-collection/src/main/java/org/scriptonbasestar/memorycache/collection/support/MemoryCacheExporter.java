package org.scriptonbasestar.memorycache.collection.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.memorycache.collection.map.SBMemoryCache;
import org.scriptonbasestar.memorycache.core.exception.SBCacheExportException;
import org.scriptonbasestar.memorycache.core.key.MemoryKey;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 캐시 내용을 로그용 JSON으로 내보냅니다.
 * <p>
 * {@link SBMemoryCache#getAllEntries(String)} 결과를 {@code "owner:category:subKey" -> data}
 * 형태의 평면 객체로 직렬화합니다. 생성 시각, 접근 횟수, TTL 같은 내부 메타데이터는 포함하지 않습니다.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoryCacheExporter {

	private final ObjectMapper objectMapper;

	public MemoryCacheExporter() {
		this(new ObjectMapper());
	}

	/**
	 * @param objectMapper Jackson ObjectMapper
	 */
	public MemoryCacheExporter(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	public String toJson(SBMemoryCache cache) {
		return toJson(cache.getAllEntries());
	}

	public String toJson(SBMemoryCache cache, String owner) {
		return toJson(cache.getAllEntries(owner));
	}

	/**
	 * @param entries 키-값 스냅샷
	 * @return JSON 문자열
	 * @throws SBCacheExportException 직렬화 실패 시
	 */
	public String toJson(Map<MemoryKey, Map<String, Object>> entries) {
		Map<String, Map<String, Object>> flat = new LinkedHashMap<>();
		for (Map.Entry<MemoryKey, Map<String, Object>> entry : entries.entrySet()) {
			flat.put(entry.getKey().toString(), entry.getValue());
		}
		try {
			return objectMapper.writeValueAsString(flat);
		} catch (JsonProcessingException e) {
			throw new SBCacheExportException("Failed to export " + entries.size() + " cache entries", e);
		}
	}
}
