package com.study.webflux.npc.application.dialogue.pipeline;

/** 대화 턴의 진행 상태입니다. 항상 앞으로만 진행합니다. */
public enum TurnPhase {
	START, RETRIEVE, MERGE, GENERATE, REVISE, PERSIST, DONE, ABORTED
}
