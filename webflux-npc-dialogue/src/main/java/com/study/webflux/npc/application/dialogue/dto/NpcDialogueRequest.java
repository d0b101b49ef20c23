package com.study.webflux.npc.application.dialogue.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(description = "NPC 대화 Request")
public record NpcDialogueRequest(
	@Schema(description = "NPC ID", example = "blacksmith")
	@NotBlank @Pattern(regexp = "^[a-zA-Z0-9_-]{1,64}$") String npcId,

	@Schema(description = "플레이어 ID (생략 시 player)", example = "p1")
	@Size(max = 128) String playerId,

	@Schema(description = "플레이어 발화", example = "안녕하세요, 검을 하나 맞추고 싶어요")
	@NotBlank @Size(max = 1000) String message
) {
}
