package com.study.webflux.npc.domain.llm.model;

public enum MessageRole {
	SYSTEM, USER, ASSISTANT
}
