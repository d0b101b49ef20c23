package com.study.webflux.npc.application.npc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.affinity.port.RelationshipPort;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import com.study.webflux.npc.domain.memory.model.EpisodicMemory;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryDirectory;
import com.study.webflux.npc.domain.memory.port.ShortTermMemoryPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 대화 턴 밖에서 NPC의 호감도와 기억을 조회하거나 조정합니다.
 */
@Slf4j
public class NpcStateService {

	private final CollaboratorBinding<RelationshipPort> relationship;
	private final ShortTermMemoryPort shortTermMemory;
	private final EpisodicMemoryDirectory episodicMemories;

	public NpcStateService(CollaboratorBinding<RelationshipPort> relationship,
		ShortTermMemoryPort shortTermMemory,
		EpisodicMemoryDirectory episodicMemories) {
		this.relationship = relationship;
		this.shortTermMemory = shortTermMemory;
		this.episodicMemories = episodicMemories;
	}

	/**
	 * 현재 호감도를 조회합니다. 호감도 협력자가 없으면 기본 관계를 반환합니다.
	 */
	public Mono<AffinitySnapshot> affinityOf(NpcId npcId, PlayerId playerId) {
		return relationship.fold(
			port -> port.getScore(npcId, playerId).map(score -> snapshotOf(port, score)),
			() -> Mono.just(AffinitySnapshot.neutral()));
	}

	/**
	 * 여러 NPC에 대한 플레이어의 호감도를 주어진 순서대로 조회합니다.
	 */
	public Mono<Map<NpcId, AffinitySnapshot>> affinitiesOf(List<NpcId> npcIds, PlayerId playerId) {
		return Flux.fromIterable(npcIds)
			.concatMap(npcId -> affinityOf(npcId, playerId).map(snapshot -> Map.entry(npcId, snapshot)))
			.collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
	}

	/**
	 * 호감도를 직접 설정합니다.
	 *
	 * @return 저장된 호감도, 호감도 협력자가 없으면 빈 Mono
	 */
	public Mono<AffinitySnapshot> setAffinity(NpcId npcId, PlayerId playerId, double score) {
		return relationship.fold(
			port -> port.setScore(npcId, playerId, score)
				.doOnNext(saved -> log.info("호감도 설정: npc={}, player={}, score={}",
					npcId.value(),
					playerId.value(),
					saved))
				.map(saved -> snapshotOf(port, saved)),
			() -> Mono.<AffinitySnapshot>empty());
	}

	/** 단기 대화 기록을 삭제합니다. */
	public Mono<Boolean> clearHistory(NpcId npcId, PlayerId playerId) {
		return shortTermMemory.clear(npcId, playerId);
	}

	/** 장기 기억을 최신순으로 조회합니다. 저장소가 없는 NPC는 빈 목록입니다. */
	public Mono<List<EpisodicMemory>> memoriesOf(NpcId npcId, int limit) {
		return episodicMemories.storeFor(npcId).fold(
			store -> store.recent(npcId, limit),
			() -> Mono.just(List.<EpisodicMemory>of()));
	}

	private AffinitySnapshot snapshotOf(RelationshipPort port, double score) {
		return AffinitySnapshot.of(score, port.levelOf(score), port.styleOf(score));
	}
}
