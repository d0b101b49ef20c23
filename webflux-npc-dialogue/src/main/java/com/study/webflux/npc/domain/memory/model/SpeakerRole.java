package com.study.webflux.npc.domain.memory.model;

public enum SpeakerRole {
	HUMAN("human"), AI("ai");

	private final String value;

	SpeakerRole(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static SpeakerRole fromValue(String value) {
		for (SpeakerRole role : values()) {
			if (role.value.equalsIgnoreCase(value)) {
				return role;
			}
		}
		throw new IllegalArgumentException("Unknown speaker role: " + value);
	}
}
