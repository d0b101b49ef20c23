package com.study.webflux.npc.domain.memory.model;

/**
 * 단기 대화 기록의 한 항목입니다.
 */
public record DialogueMessage(
	SpeakerRole role,
	String content
) {
	public DialogueMessage {
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (content == null) {
			throw new IllegalArgumentException("content cannot be null");
		}
		content = content.strip();
	}

	public static DialogueMessage human(String content) {
		return new DialogueMessage(SpeakerRole.HUMAN, content);
	}

	public static DialogueMessage ai(String content) {
		return new DialogueMessage(SpeakerRole.AI, content);
	}
}
