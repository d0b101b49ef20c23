package com.study.webflux.npc.application.agent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import com.study.webflux.npc.domain.memory.model.EpisodicMemory;
import com.study.webflux.npc.domain.memory.model.PersistenceReceipt;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryDirectory;
import com.study.webflux.npc.domain.memory.port.ShortTermMemoryPort;
import reactor.core.publisher.Mono;

/**
 * 플레이어 발화와 최종 응답을 단기 기록에 추가하고, 장기 기억 저장소가 있는 NPC면 두 항목을 장기 기억에도 저장합니다.
 *
 * <p>
 * 저장 실패는 {@link PersistenceReceipt#innerFault()}로만 남기고 항상 성공합니다.
 */
@Slf4j
public class MemoryPersistenceAgent extends AbstractDialogueAgent<PersistenceReceipt> {

	static final String PLAYER_SPEAKER = "player";

	private final ShortTermMemoryPort shortTermMemory;
	private final EpisodicMemoryDirectory episodicMemories;

	public MemoryPersistenceAgent(ShortTermMemoryPort shortTermMemory,
		EpisodicMemoryDirectory episodicMemories,
		Clock clock) {
		super(clock);
		this.shortTermMemory = shortTermMemory;
		this.episodicMemories = episodicMemories;
	}

	@Override
	public DialogueStage stage() {
		return DialogueStage.MEMORY_PERSISTENCE;
	}

	@Override
	protected Mono<PersistenceReceipt> run(ConversationContext context) {
		String reply = context.finalReply();
		List<String> faults = new ArrayList<>();

		Mono<Boolean> history = Mono.defer(() -> shortTermMemory
			.append(context.npcId(), context.playerId(), DialogueMessage.human(context.utterance()))
			.then(shortTermMemory.append(context.npcId(),
				context.playerId(),
				DialogueMessage.ai(reply)))
			.then(shortTermMemory.extendExpiry(context.npcId(), context.playerId())))
			.thenReturn(true)
			.onErrorResume(error -> {
				log.warn("[{}] 단기 기록 저장 실패: {}", context.id(), describe(error));
				faults.add("short-term: " + describe(error));
				return Mono.just(false);
			});

		return history.flatMap(appended -> storeEpisodic(context, reply, faults)
			.map(stored -> new PersistenceReceipt(appended, stored, String.join("; ", faults))));
	}

	private Mono<Integer> storeEpisodic(ConversationContext context,
		String reply,
		List<String> faults) {
		return episodicMemories.storeFor(context.npcId()).fold(
			store -> {
				List<EpisodicMemory> entries = entriesOf(context, reply);
				return Mono.defer(() -> store.add(context.npcId(), entries))
					.thenReturn(entries.size())
					.onErrorResume(error -> {
						log.warn("[{}] 장기 기억 저장 실패: {}", context.id(), describe(error));
						faults.add("episodic: " + describe(error));
						return Mono.just(0);
					});
			},
			() -> Mono.just(0));
	}

	private List<EpisodicMemory> entriesOf(ConversationContext context, String reply) {
		String timestamp = clock().instant().toString();
		String playerId = context.playerId().value();
		return List.of(
			new EpisodicMemory("플레이어: " + context.utterance(),
				Map.of(EpisodicMemory.SPEAKER, PLAYER_SPEAKER,
					EpisodicMemory.PLAYER_ID, playerId,
					EpisodicMemory.TIMESTAMP, timestamp,
					EpisodicMemory.TYPE, EpisodicMemory.TYPE_PLAYER_MESSAGE)),
			new EpisodicMemory(context.profile().name() + ": " + reply,
				Map.of(EpisodicMemory.SPEAKER, context.profile().name(),
					EpisodicMemory.PLAYER_ID, playerId,
					EpisodicMemory.TIMESTAMP, timestamp,
					EpisodicMemory.TYPE, EpisodicMemory.TYPE_NPC_RESPONSE)));
	}
}
