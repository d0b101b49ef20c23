package com.study.webflux.npc.domain.llm.model;

import java.util.List;

public record CompletionRequest(
	List<Message> messages,
	String model,
	Double temperature
) {
	public CompletionRequest {
		if (messages == null || messages.isEmpty()) {
			throw new IllegalArgumentException("messages cannot be null or empty");
		}
		messages = List.copyOf(messages);
	}

	public static CompletionRequest of(List<Message> messages, String model) {
		return new CompletionRequest(messages, model, null);
	}
}
