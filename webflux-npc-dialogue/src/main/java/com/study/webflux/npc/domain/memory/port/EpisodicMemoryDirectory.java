package com.study.webflux.npc.domain.memory.port;

import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.model.NpcId;

/** NPC마다 장기 기억 저장소가 설정되어 있는지 알려줍니다. */
@FunctionalInterface
public interface EpisodicMemoryDirectory {

	CollaboratorBinding<EpisodicMemoryPort> storeFor(NpcId npcId);

	static EpisodicMemoryDirectory none() {
		return npcId -> CollaboratorBinding.unconfigured();
	}
}
