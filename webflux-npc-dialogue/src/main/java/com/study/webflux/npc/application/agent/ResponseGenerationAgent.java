package com.study.webflux.npc.application.agent;

import java.time.Clock;
import java.util.List;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.dialogue.model.GeneratedReply;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.dialogue.port.ReplyGenerationPort;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import com.study.webflux.npc.domain.memory.model.MemorySnapshot;
import reactor.core.publisher.Mono;

/**
 * 병합된 관계/기억 블록과 현재 발화로 생성 입력을 구성하고 NPC 응답을 생성합니다.
 *
 * <p>
 * 생성 협력자가 없으면 고정된 시뮬레이션 응답을 반환합니다.
 */
public class ResponseGenerationAgent extends AbstractDialogueAgent<GeneratedReply> {

	static final String CURRENT_TURN_HEADER = "【현재 대화】";

	private final CollaboratorBinding<ReplyGenerationPort> generator;

	public ResponseGenerationAgent(CollaboratorBinding<ReplyGenerationPort> generator,
		Clock clock) {
		super(clock);
		this.generator = generator;
	}

	@Override
	public DialogueStage stage() {
		return DialogueStage.RESPONSE_GENERATION;
	}

	@Override
	protected Mono<GeneratedReply> run(ConversationContext context) {
		MemorySnapshot memory = context.memory().orElse(MemorySnapshot.empty());
		AffinitySnapshot affinity = context.affinity().orElse(AffinitySnapshot.neutral());
		String composedInput = compose(affinity, memory, context.utterance());
		List<DialogueMessage> history = memory.history();

		return generator.fold(
			port -> port.generate(composedInput, history, context.profile())
				.map(reply -> new GeneratedReply(reply.strip(), composedInput)),
			() -> Mono.just(new GeneratedReply(simulatedReply(context.profile()), composedInput)));
	}

	/**
	 * 관계 블록, 기억 블록(있으면 빈 줄 포함), 현재 대화 블록 순서로 생성 입력을 만듭니다.
	 */
	static String compose(AffinitySnapshot affinity, MemorySnapshot memory, String utterance) {
		StringBuilder builder = new StringBuilder(affinity.narrative());
		if (memory.hasNarrative()) {
			builder.append(memory.narrative()).append("\n\n");
		}
		builder.append(CURRENT_TURN_HEADER).append("\n플레이어: ").append(utterance);
		return builder.toString();
	}

	static String simulatedReply(NpcProfile profile) {
		return "안녕하세요! 저는 " + profile.name() + "입니다. (시뮬레이션 모드)";
	}
}
