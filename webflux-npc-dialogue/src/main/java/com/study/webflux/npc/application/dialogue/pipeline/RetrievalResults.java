package com.study.webflux.npc.application.dialogue.pipeline;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.agent.model.AgentResult;
import com.study.webflux.npc.domain.memory.model.MemorySnapshot;

/** 조회 단계 두 갈래의 결과를 묶습니다. */
record RetrievalResults(
	AgentResult<MemorySnapshot> memory,
	AgentResult<AffinitySnapshot> affinity
) {
}
