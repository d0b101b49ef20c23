package com.study.webflux.npc.domain.ambient.model;

public enum AmbientSource {
	/** 한 번의 LLM 호출로 생성 */
	GENERATED,
	/** 시간대별 기본 대사 */
	PRESET
}
