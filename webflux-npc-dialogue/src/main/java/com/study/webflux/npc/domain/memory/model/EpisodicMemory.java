package com.study.webflux.npc.domain.memory.model;

import java.util.Map;

/**
 * 장기 기억 저장소의 항목입니다. 메타데이터에는 화자, 플레이어, 시각, 유형이 들어갑니다.
 */
public record EpisodicMemory(
	String content,
	Map<String, Object> metadata
) {
	public static final String SPEAKER = "speaker";
	public static final String PLAYER_ID = "playerId";
	public static final String TIMESTAMP = "timestamp";
	public static final String TYPE = "type";
	public static final String TYPE_PLAYER_MESSAGE = "player_message";
	public static final String TYPE_NPC_RESPONSE = "npc_response";

	public EpisodicMemory {
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("content cannot be null or blank");
		}
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	public static EpisodicMemory of(String content) {
		return new EpisodicMemory(content, Map.of());
	}

	public String speaker() {
		Object speaker = metadata.get(SPEAKER);
		return speaker == null ? "" : speaker.toString();
	}

	public String timestamp() {
		Object timestamp = metadata.get(TIMESTAMP);
		return timestamp == null ? "" : timestamp.toString();
	}
}
