package com.study.webflux.npc.domain.dialogue.model;

/**
 * NPC의 정적 역할 정보입니다. 이름을 제외한 항목은 비어 있을 수 있습니다.
 */
public record NpcProfile(
	String name,
	String title,
	String personality,
	String expertise,
	String speakingStyle,
	String hobbies,
	String location,
	String activity
) {
	public NpcProfile {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("npc name cannot be null or blank");
		}
		title = title == null ? "" : title.trim();
		personality = personality == null ? "" : personality.trim();
		expertise = expertise == null ? "" : expertise.trim();
		speakingStyle = speakingStyle == null ? "" : speakingStyle.trim();
		hobbies = hobbies == null ? "" : hobbies.trim();
		location = location == null ? "" : location.trim();
		activity = activity == null ? "" : activity.trim();
	}

	public static NpcProfile named(String name) {
		return new NpcProfile(name, null, null, null, null, null, null, null);
	}

	/** 검토 프롬프트에 들어가는 한 줄 요약입니다. */
	public String describe() {
		StringBuilder builder = new StringBuilder(name);
		if (!title.isBlank()) {
			builder.append(" (").append(title).append(")");
		}
		if (!personality.isBlank()) {
			builder.append(", 성격: ").append(personality);
		}
		if (!speakingStyle.isBlank()) {
			builder.append(", 말투: ").append(speakingStyle);
		}
		return builder.toString();
	}
}
