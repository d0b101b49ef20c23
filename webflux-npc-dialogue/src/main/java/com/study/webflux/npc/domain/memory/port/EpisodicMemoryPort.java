package com.study.webflux.npc.domain.memory.port;

import java.util.List;

import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.memory.model.EpisodicMemory;
import reactor.core.publisher.Mono;

/** NPC별 장기 기억 저장소입니다. */
public interface EpisodicMemoryPort {

	/**
	 * 질의와 의미적으로 가까운 기억을 조회합니다.
	 *
	 * @param npcId
	 *            NPC ID
	 * @param query
	 *            검색 질의
	 * @param topK
	 *            최대 결과 수
	 * @return 유사도 순으로 정렬된 기억
	 */
	Mono<List<EpisodicMemory>> search(NpcId npcId, String query, int topK);

	Mono<Void> add(NpcId npcId, List<EpisodicMemory> entries);

	/** 최근 기억을 최신순으로 조회합니다. */
	Mono<List<EpisodicMemory>> recent(NpcId npcId, int limit);
}
