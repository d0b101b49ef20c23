package com.study.webflux.npc.domain.dialogue.model;

import java.time.Instant;

public record ContextSummary(
	String contextId,
	String npcId,
	String playerId,
	String utterancePreview,
	boolean hasMemory,
	boolean hasAffinity,
	boolean hasDialogue,
	boolean hasRevision,
	Instant createdAt
) {
}
