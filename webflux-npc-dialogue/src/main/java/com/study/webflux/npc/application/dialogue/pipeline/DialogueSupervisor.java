package com.study.webflux.npc.application.dialogue.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.application.agent.AffinityRetrievalAgent;
import com.study.webflux.npc.application.agent.AffinityUpdateAgent;
import com.study.webflux.npc.application.agent.MemoryPersistenceAgent;
import com.study.webflux.npc.application.agent.MemoryRetrievalAgent;
import com.study.webflux.npc.application.agent.ReplyRevisionAgent;
import com.study.webflux.npc.application.agent.ResponseGenerationAgent;
import com.study.webflux.npc.application.dialogue.context.ConversationContextRegistry;
import com.study.webflux.npc.application.monitoring.TurnMetricsRecorder;
import com.study.webflux.npc.domain.affinity.model.AffinityChange;
import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.agent.model.AgentResult;
import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.agent.port.DialogueAgent;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import com.study.webflux.npc.domain.dialogue.model.TurnResult;
import com.study.webflux.npc.domain.dialogue.port.DialogueTurnUseCase;
import com.study.webflux.npc.domain.memory.model.MemorySnapshot;
import com.study.webflux.npc.domain.memory.model.PersistenceReceipt;
import reactor.core.publisher.Mono;

/**
 * 대화 턴의 단계 순서와 실패 정책을 관리합니다.
 *
 * <p>
 * {@code START → RETRIEVE(기억 ∥호감도) → MERGE → GENERATE → [REVISE] → PERSIST → DONE} 순서로만 진행합니다. 생성 실패만
 * 턴을 중단({@code ABORTED})시키며, 조회와 검토 실패는 기본값으로 대체하고, 호감도 갱신과 기억 저장 실패는 진단 플래그로만 남깁니다.
 * 각 단계는 {@link AgentResult#success()}로만 분기합니다.
 */
@Slf4j
public class DialogueSupervisor implements DialogueTurnUseCase {

	private final MemoryRetrievalAgent memoryRetrievalAgent;
	private final AffinityRetrievalAgent affinityRetrievalAgent;
	private final ResponseGenerationAgent responseGenerationAgent;
	private final ReplyRevisionAgent replyRevisionAgent;
	private final AffinityUpdateAgent affinityUpdateAgent;
	private final MemoryPersistenceAgent memoryPersistenceAgent;
	private final ConversationContextRegistry registry;
	private final TurnMetricsRecorder metricsRecorder;
	private final boolean parallelRetrieval;
	private final Clock clock;

	public DialogueSupervisor(MemoryRetrievalAgent memoryRetrievalAgent,
		AffinityRetrievalAgent affinityRetrievalAgent,
		ResponseGenerationAgent responseGenerationAgent,
		ReplyRevisionAgent replyRevisionAgent,
		AffinityUpdateAgent affinityUpdateAgent,
		MemoryPersistenceAgent memoryPersistenceAgent,
		ConversationContextRegistry registry,
		TurnMetricsRecorder metricsRecorder,
		boolean parallelRetrieval,
		Clock clock) {
		this.memoryRetrievalAgent = memoryRetrievalAgent;
		this.affinityRetrievalAgent = affinityRetrievalAgent;
		this.responseGenerationAgent = responseGenerationAgent;
		this.replyRevisionAgent = replyRevisionAgent;
		this.affinityUpdateAgent = affinityUpdateAgent;
		this.memoryPersistenceAgent = memoryPersistenceAgent;
		this.registry = registry;
		this.metricsRecorder = metricsRecorder;
		this.parallelRetrieval = parallelRetrieval;
		this.clock = clock;
	}

	@Override
	public Mono<TurnResult> runTurn(NpcId npcId,
		PlayerId playerId,
		String utterance,
		NpcProfile profile) {
		return Mono.defer(() -> {
			long startedAt = System.nanoTime();
			ConversationContext context = registry.open(npcId, playerId, utterance, profile);
			Map<DialogueStage, Boolean> stageSuccess = new EnumMap<>(DialogueStage.class);
			enter(context, TurnPhase.START);

			return retrieve(context)
				.doOnNext(results -> merge(context, results, stageSuccess))
				.flatMap(merged -> generate(context, stageSuccess, startedAt))
				.doOnNext(metricsRecorder::record)
				.doFinally(signal -> registry.touch(context.key()));
		});
	}

	/**
	 * 기억 조회와 호감도 조회를 실행합니다. 각 갈래의 오류는 갈래 안에서 실패 결과로 바뀌므로 한쪽 실패가 다른 쪽을 취소하지 않습니다.
	 */
	Mono<RetrievalResults> retrieve(ConversationContext context) {
		enter(context, TurnPhase.RETRIEVE);
		Mono<AgentResult<MemorySnapshot>> memory = isolate(memoryRetrievalAgent, context);
		Mono<AgentResult<AffinitySnapshot>> affinity = isolate(affinityRetrievalAgent, context);
		if (parallelRetrieval) {
			return Mono.zip(memory, affinity, RetrievalResults::new);
		}
		return memory.flatMap(memoryResult -> affinity
			.map(affinityResult -> new RetrievalResults(memoryResult, affinityResult)));
	}

	/**
	 * 조회 결과를 컨텍스트에 반영합니다. 실패한 갈래는 빈 기억과 처음 만난 관계로 대체합니다.
	 */
	void merge(ConversationContext context,
		RetrievalResults results,
		Map<DialogueStage, Boolean> stageSuccess) {
		enter(context, TurnPhase.MERGE);
		AgentResult<MemorySnapshot> memory = results.memory();
		AgentResult<AffinitySnapshot> affinity = results.affinity();
		stageSuccess.put(DialogueStage.MEMORY_RETRIEVAL, memory.success());
		stageSuccess.put(DialogueStage.AFFINITY_RETRIEVAL, affinity.success());

		if (!memory.success()) {
			log.warn("[{}] 기억 조회 실패, 빈 기억으로 진행: {}", context.id(), memory.error());
		}
		if (!affinity.success()) {
			log.warn("[{}] 호감도 조회 실패, 기본 관계로 진행: {}", context.id(), affinity.error());
		}
		context.applyMemory(memory.success() ? memory.payload() : MemorySnapshot.empty());
		context.applyAffinity(affinity.success() ? affinity.payload() : AffinitySnapshot.neutral());
	}

	private Mono<TurnResult> generate(ConversationContext context,
		Map<DialogueStage, Boolean> stageSuccess,
		long startedAt) {
		enter(context, TurnPhase.GENERATE);
		return isolate(responseGenerationAgent, context).flatMap(generated -> {
			stageSuccess.put(DialogueStage.RESPONSE_GENERATION, generated.success());
			if (!generated.success()) {
				enter(context, TurnPhase.ABORTED);
				log.error("[{}] 응답 생성 실패로 턴 중단: {}", context.id(), generated.error());
				return Mono.just(TurnResult.aborted(generated.error(),
					affinityScoreOf(context),
					stageSuccess,
					since(startedAt),
					context.id()));
			}
			context.applyDialogue(generated.payload());
			return revise(context, stageSuccess)
				.then(Mono.defer(() -> persist(context, stageSuccess)))
				.map(change -> {
					enter(context, TurnPhase.DONE);
					return TurnResult.completed(context.finalReply(),
						affinityScoreOf(context),
						change.changed(),
						stageSuccess,
						since(startedAt),
						context.id());
				});
		});
	}

	/**
	 * 검토 단계가 활성화된 경우에만 실행합니다. 실패 결과면 생성된 응답을 그대로 사용합니다.
	 */
	private Mono<Void> revise(ConversationContext context,
		Map<DialogueStage, Boolean> stageSuccess) {
		if (!replyRevisionAgent.isActive()) {
			log.debug("[{}] 응답 검토 비활성화", context.id());
			return Mono.empty();
		}
		enter(context, TurnPhase.REVISE);
		return isolate(replyRevisionAgent, context)
			.doOnNext(result -> {
				if (result.success()) {
					context.applyRevision(result.payload());
					stageSuccess.put(DialogueStage.REVISION, !result.payload().reviewFailed());
				} else {
					log.warn("[{}] 응답 검토 실패, 생성된 응답 유지: {}", context.id(), result.error());
					stageSuccess.put(DialogueStage.REVISION, false);
				}
			})
			.then();
	}

	/**
	 * 호감도 갱신과 기억 저장을 함께 실행하고 둘 다 끝날 때까지 기다립니다. 결과는 진단 플래그에만 반영됩니다.
	 */
	private Mono<AffinityChange> persist(ConversationContext context,
		Map<DialogueStage, Boolean> stageSuccess) {
		enter(context, TurnPhase.PERSIST);
		return Mono.zip(isolate(affinityUpdateAgent, context),
			isolate(memoryPersistenceAgent, context))
			.map(results -> {
				AgentResult<AffinityChange> affinity = results.getT1();
				AgentResult<PersistenceReceipt> persistence = results.getT2();
				stageSuccess.put(DialogueStage.AFFINITY_UPDATE,
					affinity.success() && !affinity.payload().hasFault());
				stageSuccess.put(DialogueStage.MEMORY_PERSISTENCE,
					persistence.success() && !persistence.payload().hasFault());
				if (!persistence.success()) {
					log.warn("[{}] 기억 저장 실패: {}", context.id(), persistence.error());
				}
				if (!affinity.success()) {
					log.warn("[{}] 호감도 갱신 실패: {}", context.id(), affinity.error());
					return AffinityChange.unchanged(affinityScoreOf(context));
				}
				return affinity.payload();
			});
	}

	/**
	 * 단계 구현이 계약을 어기고 에러나 빈 시그널을 내보내더라도 실패 결과로 바꿉니다.
	 */
	private <T> Mono<AgentResult<T>> isolate(DialogueAgent<T> agent, ConversationContext context) {
		return Mono.defer(() -> agent.execute(context))
			.onErrorResume(error -> Mono.just(AgentResult.failure(agent.stage(),
				error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage(),
				Duration.ZERO,
				clock.instant())))
			.switchIfEmpty(Mono.fromSupplier(() -> AgentResult.failure(agent.stage(),
				agent.stage().agentName() + " produced no result",
				Duration.ZERO,
				clock.instant())));
	}

	private double affinityScoreOf(ConversationContext context) {
		return context.affinity()
			.map(AffinitySnapshot::score)
			.orElse(AffinitySnapshot.NEUTRAL_SCORE);
	}

	private void enter(ConversationContext context, TurnPhase phase) {
		log.debug("[{}] {}", context.id(), phase);
	}

	private static Duration since(long startedAt) {
		return Duration.ofNanos(System.nanoTime() - startedAt);
	}
}
