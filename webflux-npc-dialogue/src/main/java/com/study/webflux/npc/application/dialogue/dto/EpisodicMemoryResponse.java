package com.study.webflux.npc.application.dialogue.dto;

import com.study.webflux.npc.domain.memory.model.EpisodicMemory;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "장기 기억 항목")
public record EpisodicMemoryResponse(
	@Schema(description = "내용", example = "플레이어: 검을 하나 맞추고 싶어요") String content,
	@Schema(description = "화자", example = "player") String speaker,
	@Schema(description = "기록 시각", example = "2024-12-21T12:00:00Z") String timestamp
) {
	public static EpisodicMemoryResponse from(EpisodicMemory memory) {
		return new EpisodicMemoryResponse(memory.content(), memory.speaker(), memory.timestamp());
	}
}
