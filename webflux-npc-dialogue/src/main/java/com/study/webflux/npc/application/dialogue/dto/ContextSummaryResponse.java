package com.study.webflux.npc.application.dialogue.dto;

import java.time.Instant;

import com.study.webflux.npc.domain.dialogue.model.ContextSummary;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "대화 컨텍스트 요약")
public record ContextSummaryResponse(
	String contextId,
	String npcId,
	String playerId,
	@Schema(description = "플레이어 발화 앞 50자") String message,
	boolean hasMemory,
	boolean hasAffinity,
	boolean hasDialogue,
	boolean hasRevision,
	Instant createdAt
) {
	public static ContextSummaryResponse from(ContextSummary summary) {
		return new ContextSummaryResponse(summary.contextId(),
			summary.npcId(),
			summary.playerId(),
			summary.utterancePreview(),
			summary.hasMemory(),
			summary.hasAffinity(),
			summary.hasDialogue(),
			summary.hasRevision(),
			summary.createdAt());
	}
}
