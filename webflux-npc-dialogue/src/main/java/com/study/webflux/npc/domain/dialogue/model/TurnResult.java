package com.study.webflux.npc.domain.dialogue.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.study.webflux.npc.domain.agent.model.DialogueStage;

/**
 * 한 턴의 최종 결과입니다. 성공이면 응답을, 중단이면 치명적 오류 메시지를 담습니다.
 *
 * <p>
 * {@code affinityScore}는 이번 턴이 시작될 때 읽은 호감도이며 갱신 이후 값이 아닙니다.
 */
public record TurnResult(
	boolean success,
	String reply,
	double affinityScore,
	boolean affinityChanged,
	Map<DialogueStage, Boolean> stageSuccess,
	Duration elapsed,
	String error,
	String contextId
) {
	public TurnResult {
		stageSuccess = stageSuccess == null || stageSuccess.isEmpty()
			? Map.of()
			: Collections.unmodifiableMap(new EnumMap<>(stageSuccess));
		elapsed = elapsed == null ? Duration.ZERO : elapsed;
		error = error == null ? "" : error;
		if (success == !error.isEmpty()) {
			throw new IllegalArgumentException("error must be empty iff the turn succeeded");
		}
	}

	public static TurnResult completed(String reply,
		double affinityScore,
		boolean affinityChanged,
		Map<DialogueStage, Boolean> stageSuccess,
		Duration elapsed,
		String contextId) {
		return new TurnResult(true,
			reply,
			affinityScore,
			affinityChanged,
			stageSuccess,
			elapsed,
			"",
			contextId);
	}

	public static TurnResult aborted(String error,
		double affinityScore,
		Map<DialogueStage, Boolean> stageSuccess,
		Duration elapsed,
		String contextId) {
		return new TurnResult(false,
			"",
			affinityScore,
			false,
			stageSuccess,
			elapsed,
			error == null || error.isBlank() ? "response generation failed" : error,
			contextId);
	}
}
