package com.study.webflux.npc.infrastructure.monitoring.micrometer;

import java.util.Map;

import org.springframework.stereotype.Component;

import com.study.webflux.npc.application.monitoring.TurnMetricsRecorder;
import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.TurnResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * 대화 턴 결과를 Micrometer 메트릭으로 내보냅니다.
 */
@Component
public class MicrometerTurnMetricsRecorder implements TurnMetricsRecorder {

	static final String METRIC_PREFIX = "npc.dialogue.turn";

	private final MeterRegistry meterRegistry;

	public MicrometerTurnMetricsRecorder(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;
	}

	@Override
	public void record(TurnResult result) {
		String status = result.success() ? "success" : "aborted";

		Timer.builder(METRIC_PREFIX + ".duration")
			.tag("status", status)
			.description("NPC dialogue turn execution time")
			.register(meterRegistry)
			.record(result.elapsed());

		// 턴 결과별 실행 횟수
		Counter.builder(METRIC_PREFIX + ".executions")
			.tag("status", status)
			.description("Number of NPC dialogue turns")
			.register(meterRegistry)
			.increment();

		for (Map.Entry<DialogueStage, Boolean> entry : result.stageSuccess().entrySet()) {
			Counter.builder(METRIC_PREFIX + ".stage")
				.tag("stage", entry.getKey().name().toLowerCase())
				.tag("outcome", entry.getValue() ? "success" : "failure")
				.description("Stage outcomes per dialogue turn")
				.register(meterRegistry)
				.increment();
		}

		if (result.affinityChanged()) {
			meterRegistry.counter(METRIC_PREFIX + ".affinity.changed").increment();
		}
	}
}
