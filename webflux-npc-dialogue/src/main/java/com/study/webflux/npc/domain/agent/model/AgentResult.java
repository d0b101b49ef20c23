package com.study.webflux.npc.domain.agent.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 단계 하나의 실행 결과입니다.
 *
 * <p>
 * {@code error}는 실패일 때만 비어 있지 않습니다. 실패 결과의 {@code payload}는 신뢰할 수 없으므로 후속 단계가 읽지 않습니다.
 */
public record AgentResult<T>(
	boolean success,
	T payload,
	String error,
	DialogueStage producer,
	Duration elapsed,
	Instant completedAt
) {
	public AgentResult {
		if (producer == null) {
			throw new IllegalArgumentException("producer cannot be null");
		}
		error = error == null ? "" : error;
		if (success && !error.isEmpty()) {
			throw new IllegalArgumentException("successful result cannot carry an error");
		}
		if (!success && error.isBlank()) {
			throw new IllegalArgumentException("failed result must carry an error");
		}
		if (success && payload == null) {
			throw new IllegalArgumentException("successful result must carry a payload");
		}
		elapsed = elapsed == null ? Duration.ZERO : elapsed;
		completedAt = completedAt == null ? Instant.EPOCH : completedAt;
	}

	public static <T> AgentResult<T> success(DialogueStage producer,
		T payload,
		Duration elapsed,
		Instant completedAt) {
		return new AgentResult<>(true, payload, "", producer, elapsed, completedAt);
	}

	public static <T> AgentResult<T> failure(DialogueStage producer,
		String error,
		Duration elapsed,
		Instant completedAt) {
		return new AgentResult<>(false, null, error, producer, elapsed, completedAt);
	}

	public String agentName() {
		return producer.agentName();
	}
}
