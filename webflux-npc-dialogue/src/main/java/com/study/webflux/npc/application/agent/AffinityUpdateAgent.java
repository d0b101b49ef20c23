package com.study.webflux.npc.application.agent;

import java.time.Clock;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.affinity.model.AffinityChange;
import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.affinity.port.RelationshipPort;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import reactor.core.publisher.Mono;

/**
 * 최종 응답이 정해진 뒤 호감도를 갱신합니다. 갱신 실패는 {@link AffinityChange#innerFault()}로만 남기고 항상 성공합니다.
 */
@Slf4j
public class AffinityUpdateAgent extends AbstractDialogueAgent<AffinityChange> {

	private final CollaboratorBinding<RelationshipPort> relationship;

	public AffinityUpdateAgent(CollaboratorBinding<RelationshipPort> relationship, Clock clock) {
		super(clock);
		this.relationship = relationship;
	}

	@Override
	public DialogueStage stage() {
		return DialogueStage.AFFINITY_UPDATE;
	}

	@Override
	protected Mono<AffinityChange> run(ConversationContext context) {
		double currentScore = context.affinity()
			.map(AffinitySnapshot::score)
			.orElse(AffinitySnapshot.NEUTRAL_SCORE);

		return relationship.fold(
			port -> Mono.defer(() -> port.analyzeAndUpdate(context.npcId(),
				context.playerId(),
				context.utterance(),
				context.finalReply()))
				.defaultIfEmpty(AffinityChange.unchanged(currentScore))
				.doOnNext(change -> {
					if (change.changed()) {
						log.info("[{}] 호감도 변경: {} -> {} ({})",
							context.id(),
							change.previousScore(),
							change.newScore(),
							change.delta());
					}
				})
				.onErrorResume(error -> {
					log.warn("[{}] 호감도 갱신 실패: {}", context.id(), describe(error));
					return Mono.just(AffinityChange.failed(currentScore, describe(error)));
				}),
			() -> Mono.just(AffinityChange.unchanged(currentScore)));
	}
}
