package com.study.webflux.npc.domain.dialogue.model;

import java.time.Instant;

/**
 * NPC, 플레이어, 생성 시각으로 구성된 대화 컨텍스트 식별자입니다.
 */
public record ContextKey(
	NpcId npcId,
	PlayerId playerId,
	Instant createdAt
) {
	public ContextKey {
		if (npcId == null) {
			throw new IllegalArgumentException("npcId cannot be null");
		}
		if (playerId == null) {
			throw new IllegalArgumentException("playerId cannot be null");
		}
		if (createdAt == null) {
			throw new IllegalArgumentException("createdAt cannot be null");
		}
	}

	public String asString() {
		return npcId.value() + "_" + playerId.value() + "_" + createdAt.toEpochMilli();
	}

	@Override
	public String toString() {
		return asString();
	}
}
