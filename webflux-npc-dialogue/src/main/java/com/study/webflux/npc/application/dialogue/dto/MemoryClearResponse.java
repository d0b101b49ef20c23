package com.study.webflux.npc.application.dialogue.dto;

public record MemoryClearResponse(
	String npcId,
	String playerId,
	boolean cleared
) {
}
