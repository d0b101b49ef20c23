package com.study.webflux.npc.application.agent;

import java.time.Clock;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import com.study.webflux.npc.domain.memory.model.EpisodicMemory;
import com.study.webflux.npc.domain.memory.model.MemorySnapshot;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryDirectory;
import com.study.webflux.npc.domain.memory.port.ShortTermMemoryPort;
import reactor.core.publisher.Mono;

/**
 * 최근 대화 기록과 관련 장기 기억을 조회합니다.
 *
 * <p>
 * 장기 기억 저장소가 없는 NPC는 빈 기억을 반환하며, 장기 기억 검색 실패도 빈 기억으로 대체합니다. 단기 기록 조회 실패만 단계 실패가 됩니다.
 */
@Slf4j
public class MemoryRetrievalAgent extends AbstractDialogueAgent<MemorySnapshot> {

	static final String NARRATIVE_HEADER = "【관련 기억】";
	static final int NARRATIVE_LIMIT = 3;

	private final ShortTermMemoryPort shortTermMemory;
	private final EpisodicMemoryDirectory episodicMemories;
	private final int maxHistory;
	private final int episodicTopK;

	public MemoryRetrievalAgent(ShortTermMemoryPort shortTermMemory,
		EpisodicMemoryDirectory episodicMemories,
		int maxHistory,
		int episodicTopK,
		Clock clock) {
		super(clock);
		if (maxHistory <= 0) {
			throw new IllegalArgumentException("maxHistory must be positive");
		}
		if (episodicTopK <= 0) {
			throw new IllegalArgumentException("episodicTopK must be positive");
		}
		this.shortTermMemory = shortTermMemory;
		this.episodicMemories = episodicMemories;
		this.maxHistory = maxHistory;
		this.episodicTopK = episodicTopK;
	}

	@Override
	public DialogueStage stage() {
		return DialogueStage.MEMORY_RETRIEVAL;
	}

	@Override
	protected Mono<MemorySnapshot> run(ConversationContext context) {
		return shortTermMemory.getHistory(context.npcId(), context.playerId())
			.defaultIfEmpty(List.of())
			.map(this::latest)
			.flatMap(history -> searchEpisodic(context)
				.map(episodic -> new MemorySnapshot(history, episodic, narrativeOf(episodic))));
	}

	private Mono<List<EpisodicMemory>> searchEpisodic(ConversationContext context) {
		return episodicMemories.storeFor(context.npcId()).fold(
			store -> store.search(context.npcId(), context.utterance(), episodicTopK)
				.defaultIfEmpty(List.of())
				.onErrorResume(error -> {
					log.warn("[{}] 장기 기억 검색 실패, 빈 기억으로 진행: {}",
						context.id(),
						describe(error));
					return Mono.just(List.of());
				}),
			() -> Mono.just(List.<EpisodicMemory>of()));
	}

	private List<DialogueMessage> latest(List<DialogueMessage> history) {
		if (history.size() <= maxHistory) {
			return history;
		}
		return history.subList(history.size() - maxHistory, history.size());
	}

	static String narrativeOf(List<EpisodicMemory> episodic) {
		if (episodic.isEmpty()) {
			return "";
		}
		StringBuilder builder = new StringBuilder(NARRATIVE_HEADER);
		episodic.stream()
			.limit(NARRATIVE_LIMIT)
			.forEach(memory -> builder.append("\n- ").append(memory.content()));
		return builder.toString();
	}
}
