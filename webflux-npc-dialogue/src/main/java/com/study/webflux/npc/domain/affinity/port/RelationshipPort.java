package com.study.webflux.npc.domain.affinity.port;

import com.study.webflux.npc.domain.affinity.model.AffinityChange;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import reactor.core.publisher.Mono;

/** NPC와 플레이어 사이의 호감도를 관리합니다. */
public interface RelationshipPort {

	/** 저장된 호감도를 조회합니다. 기록이 없으면 기본값을 반환합니다. */
	Mono<Double> getScore(NpcId npcId, PlayerId playerId);

	String levelOf(double score);

	String styleOf(double score);

	/**
	 * 이번 대화를 분석해 호감도를 갱신합니다.
	 *
	 * @param npcId
	 *            NPC ID
	 * @param playerId
	 *            플레이어 ID
	 * @param utterance
	 *            플레이어 발화
	 * @param reply
	 *            NPC 최종 응답
	 * @return 변경 여부와 변경 전후 점수
	 */
	Mono<AffinityChange> analyzeAndUpdate(NpcId npcId,
		PlayerId playerId,
		String utterance,
		String reply);

	/** 호감도를 직접 설정하고 저장된 값을 반환합니다. */
	Mono<Double> setScore(NpcId npcId, PlayerId playerId, double score);
}
