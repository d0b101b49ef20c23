package com.study.webflux.npc.domain.dialogue.model;

public record PlayerId(
	String value
) {
	public static final PlayerId DEFAULT = new PlayerId("player");

	public PlayerId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("playerId cannot be null or blank");
		}
		if (value.length() > 128) {
			throw new IllegalArgumentException("playerId too long");
		}
		if (value.contains(":")) {
			throw new IllegalArgumentException("playerId must not contain ':'");
		}
	}

	public static PlayerId of(String value) {
		return new PlayerId(value);
	}

	public static PlayerId ofNullable(String value) {
		return (value == null || value.isBlank()) ? DEFAULT : new PlayerId(value);
	}
}
