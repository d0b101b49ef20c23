package com.study.webflux.npc.application.dialogue.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(description = "호감도 설정 Request")
public record AffinityUpdateRequest(
	@Schema(description = "플레이어 ID (생략 시 player)", example = "p1")
	@Size(max = 128) String playerId,

	@Schema(description = "설정할 호감도", example = "75")
	@NotNull @DecimalMin("0.0") @DecimalMax("100.0") Double affinity
) {
}
