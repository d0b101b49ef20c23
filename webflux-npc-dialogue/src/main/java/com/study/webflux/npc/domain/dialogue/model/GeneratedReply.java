package com.study.webflux.npc.domain.dialogue.model;

/**
 * 생성 단계의 출력입니다. 생성에 실제로 전달된 합성 입력을 진단용으로 함께 보관합니다.
 */
public record GeneratedReply(
	String reply,
	String composedInput
) {
	public GeneratedReply {
		if (reply == null || reply.isBlank()) {
			throw new IllegalArgumentException("reply cannot be null or blank");
		}
		if (composedInput == null) {
			throw new IllegalArgumentException("composedInput cannot be null");
		}
	}
}
