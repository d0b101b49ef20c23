package com.study.webflux.npc.domain.dialogue.model;

public record NpcId(
	String value
) {
	public NpcId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("npcId cannot be null or blank");
		}
		if (value.length() > 64) {
			throw new IllegalArgumentException("npcId too long");
		}
		if (!value.matches("^[a-zA-Z0-9_-]+$")) {
			throw new IllegalArgumentException(
				"npcId must contain only alphanumeric characters, hyphens, and underscores");
		}
	}

	public static NpcId of(String value) {
		return new NpcId(value);
	}
}
