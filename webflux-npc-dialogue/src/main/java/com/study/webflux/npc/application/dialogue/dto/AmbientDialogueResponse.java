package com.study.webflux.npc.application.dialogue.dto;

import java.time.Instant;
import java.util.List;

import com.study.webflux.npc.domain.ambient.model.AmbientDialogueBatch;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "NPC 배경 대사 묶음")
public record AmbientDialogueResponse(
	@Schema(description = "NPC별 대사 (등록 순서)") List<AmbientLine> lines,
	@Schema(description = "생성 방식", example = "GENERATED", allowableValues = {"GENERATED", "PRESET"}) String source,
	@Schema(description = "시간대", example = "morning") String period,
	@Schema(description = "장면 설명") String scene,
	Instant generatedAt
) {
	public static AmbientDialogueResponse from(AmbientDialogueBatch batch) {
		List<AmbientLine> lines = batch.lines().entrySet().stream()
			.map(entry -> new AmbientLine(entry.getKey().value(), entry.getValue()))
			.toList();
		return new AmbientDialogueResponse(lines,
			batch.source().name(),
			batch.period().key(),
			batch.scene(),
			batch.generatedAt());
	}

	public record AmbientLine(
		@Schema(description = "NPC ID", example = "blacksmith") String npcId,
		@Schema(description = "대사", example = "불부터 올려야지. 오늘은 주문이 밀렸어.") String line
	) {
	}
}
