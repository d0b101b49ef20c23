package com.study.webflux.npc.application.dialogue.dto;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "NPC와 플레이어의 관계")
public record AffinityResponse(
	String npcId,
	String playerId,
	@Schema(description = "호감도 (0~100)", example = "50.0") double affinity,
	@Schema(description = "관계 단계", example = "낯선 사이") String level,
	@Schema(description = "대화 스타일") String style
) {
	public static AffinityResponse of(String npcId, String playerId, AffinitySnapshot snapshot) {
		return new AffinityResponse(npcId,
			playerId,
			snapshot.score(),
			snapshot.level(),
			snapshot.style());
	}
}
