package com.study.webflux.npc.domain.memory.port;

import java.util.List;

import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import reactor.core.publisher.Mono;

/** NPC와 플레이어 쌍의 최근 대화 기록 저장소입니다. */
public interface ShortTermMemoryPort {

	/**
	 * 저장된 대화 기록을 오래된 순서로 반환합니다.
	 */
	Mono<List<DialogueMessage>> getHistory(NpcId npcId, PlayerId playerId);

	Mono<Void> append(NpcId npcId, PlayerId playerId, DialogueMessage message);

	/** 기록의 만료 시간을 연장합니다. */
	Mono<Void> extendExpiry(NpcId npcId, PlayerId playerId);

	/**
	 * 기록을 삭제합니다.
	 *
	 * @return 삭제할 기록이 있었는지 여부
	 */
	Mono<Boolean> clear(NpcId npcId, PlayerId playerId);
}
