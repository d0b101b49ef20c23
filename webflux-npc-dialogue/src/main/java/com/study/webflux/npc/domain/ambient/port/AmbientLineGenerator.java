package com.study.webflux.npc.domain.ambient.port;

import java.util.Map;

import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import reactor.core.publisher.Mono;

/** 여러 NPC의 배경 대사를 한 번에 생성합니다. */
public interface AmbientLineGenerator {

	/**
	 * @param scene
	 *            현재 장면 설명
	 * @param npcs
	 *            대사가 필요한 NPC
	 * @return 모든 NPC의 대사, 응답을 해석할 수 없으면 빈 Mono
	 */
	Mono<Map<NpcId, String>> generate(String scene, Map<NpcId, NpcProfile> npcs);
}
