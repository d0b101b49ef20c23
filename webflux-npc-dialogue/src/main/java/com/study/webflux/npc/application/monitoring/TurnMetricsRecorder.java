package com.study.webflux.npc.application.monitoring;

import com.study.webflux.npc.domain.dialogue.model.TurnResult;

/** 완료된 턴의 결과를 메트릭으로 기록합니다. */
public interface TurnMetricsRecorder {

	void record(TurnResult result);

	static TurnMetricsRecorder noop() {
		return result -> {
		};
	}
}
