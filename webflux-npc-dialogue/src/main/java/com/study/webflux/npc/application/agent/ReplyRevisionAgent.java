package com.study.webflux.npc.application.agent;

import java.time.Clock;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.dialogue.model.GeneratedReply;
import com.study.webflux.npc.domain.dialogue.model.RevisionOutcome;
import com.study.webflux.npc.domain.dialogue.port.ReplyReviewPort;
import reactor.core.publisher.Mono;

/**
 * 생성된 응답을 역할과 관계 기준으로 검토합니다.
 *
 * <p>
 * 검토 중 오류가 나도 단계는 성공하며 원래 응답과 진단 메모를 반환합니다.
 */
@Slf4j
public class ReplyRevisionAgent extends AbstractDialogueAgent<RevisionOutcome> {

	private final CollaboratorBinding<ReplyReviewPort> reviewer;
	private final boolean enabled;

	public ReplyRevisionAgent(CollaboratorBinding<ReplyReviewPort> reviewer,
		boolean enabled,
		Clock clock) {
		super(clock);
		this.reviewer = reviewer;
		this.enabled = enabled;
	}

	@Override
	public DialogueStage stage() {
		return DialogueStage.REVISION;
	}

	/** 설정으로 활성화되어 있고 검토자가 있을 때만 실행됩니다. */
	public boolean isActive() {
		return enabled && reviewer.isConfigured();
	}

	@Override
	protected Mono<RevisionOutcome> run(ConversationContext context) {
		String reply = context.dialogue()
			.map(GeneratedReply::reply)
			.orElseThrow(() -> new IllegalStateException("no generated reply to review"));
		AffinitySnapshot affinity = context.affinity().orElse(AffinitySnapshot.neutral());

		return reviewer.fold(
			port -> Mono.defer(() -> port.review(reply,
				context.utterance(),
				context.profile(),
				affinity.level(),
				affinity.style()))
				.map(verdict -> ReviewVerdict.interpret(verdict, reply))
				.defaultIfEmpty(RevisionOutcome.unchanged(reply, ""))
				.onErrorResume(error -> {
					log.warn("[{}] 응답 검토 실패, 원래 응답 유지: {}", context.id(), describe(error));
					return Mono.just(RevisionOutcome.failed(reply, "review failed: " + describe(error)));
				}),
			() -> Mono.just(RevisionOutcome.unchanged(reply, "")));
	}
}
