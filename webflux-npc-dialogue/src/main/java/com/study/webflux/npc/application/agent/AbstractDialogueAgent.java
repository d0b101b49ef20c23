package com.study.webflux.npc.application.agent;

import java.time.Clock;
import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.agent.model.AgentResult;
import com.study.webflux.npc.domain.agent.port.DialogueAgent;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import reactor.core.publisher.Mono;

/**
 * 단계 본문을 감싸 실행 시간과 결과를 기록하고, 모든 오류를 실패한 {@link AgentResult}로 변환합니다.
 */
@Slf4j
public abstract class AbstractDialogueAgent<T> implements DialogueAgent<T> {

	private final Clock clock;

	protected AbstractDialogueAgent(Clock clock) {
		this.clock = clock;
	}

	@Override
	public final Mono<AgentResult<T>> execute(ConversationContext context) {
		return Mono.defer(() -> {
			long startedAt = System.nanoTime();
			return Mono.defer(() -> run(context))
				.map(payload -> AgentResult.success(stage(),
					payload,
					since(startedAt),
					clock.instant()))
				.switchIfEmpty(Mono.fromSupplier(() -> AgentResult.failure(stage(),
					stage().agentName() + " produced no result",
					since(startedAt),
					clock.instant())))
				.onErrorResume(error -> {
					log.warn("[{}] {} 실행 실패: {}",
						context.id(),
						stage().agentName(),
						describe(error));
					return Mono.just(AgentResult.failure(stage(),
						describe(error),
						since(startedAt),
						clock.instant()));
				});
		});
	}

	/**
	 * 단계 본문입니다. 오류나 빈 결과는 {@link #execute}가 실패 결과로 변환합니다.
	 */
	protected abstract Mono<T> run(ConversationContext context);

	protected Clock clock() {
		return clock;
	}

	protected static String describe(Throwable error) {
		String message = error.getMessage();
		return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
	}

	private static Duration since(long startedAt) {
		return Duration.ofNanos(System.nanoTime() - startedAt);
	}
}
