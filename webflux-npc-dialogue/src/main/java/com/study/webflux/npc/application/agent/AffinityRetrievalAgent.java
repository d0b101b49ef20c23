package com.study.webflux.npc.application.agent;

import java.time.Clock;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.affinity.port.RelationshipPort;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import reactor.core.publisher.Mono;

/**
 * 현재 호감도를 조회해 관계 블록을 구성합니다. 호감도 협력자가 없으면 처음 만난 관계의 기본값을 반환합니다.
 */
public class AffinityRetrievalAgent extends AbstractDialogueAgent<AffinitySnapshot> {

	private final CollaboratorBinding<RelationshipPort> relationship;

	public AffinityRetrievalAgent(CollaboratorBinding<RelationshipPort> relationship, Clock clock) {
		super(clock);
		this.relationship = relationship;
	}

	@Override
	public DialogueStage stage() {
		return DialogueStage.AFFINITY_RETRIEVAL;
	}

	@Override
	protected Mono<AffinitySnapshot> run(ConversationContext context) {
		return relationship.fold(
			port -> port.getScore(context.npcId(), context.playerId())
				.map(score -> AffinitySnapshot.of(score, port.levelOf(score), port.styleOf(score))),
			() -> Mono.just(AffinitySnapshot.neutral()));
	}
}
