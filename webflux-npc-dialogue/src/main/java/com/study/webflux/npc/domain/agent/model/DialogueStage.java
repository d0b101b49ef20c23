package com.study.webflux.npc.domain.agent.model;

/** NPC 대화 턴을 구성하는 단계를 정의합니다. */
public enum DialogueStage {
	/** 단기 대화 기록과 장기 기억을 조회합니다. */
	MEMORY_RETRIEVAL("memory_agent"),

	/** 현재 호감도와 대화 스타일을 조회합니다. */
	AFFINITY_RETRIEVAL("affinity_agent"),

	/** NPC 응답을 생성합니다. 실패하면 턴이 중단됩니다. */
	RESPONSE_GENERATION("dialogue_agent"),

	/** 생성된 응답을 검토하고 필요하면 교체합니다. */
	REVISION("reflection_agent"),

	/** 이번 대화를 분석해 호감도를 갱신합니다. */
	AFFINITY_UPDATE("affinity_update_agent"),

	/** 대화를 단기 기록과 장기 기억에 저장합니다. */
	MEMORY_PERSISTENCE("memory_persistence_agent");

	private final String agentName;

	DialogueStage(String agentName) {
		this.agentName = agentName;
	}

	public String agentName() {
		return agentName;
	}
}
