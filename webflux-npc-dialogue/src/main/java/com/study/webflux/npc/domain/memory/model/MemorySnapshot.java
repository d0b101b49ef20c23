package com.study.webflux.npc.domain.memory.model;

import java.util.List;

/**
 * 기억 조회 단계의 출력입니다.
 *
 * @param history
 *            최근 대화 기록 (오래된 순)
 * @param episodic
 *            의미적으로 관련된 장기 기억
 * @param narrative
 *            생성 입력에 주입할 기억 블록 (없으면 빈 문자열)
 */
public record MemorySnapshot(
	List<DialogueMessage> history,
	List<EpisodicMemory> episodic,
	String narrative
) {
	private static final MemorySnapshot EMPTY = new MemorySnapshot(List.of(), List.of(), "");

	public MemorySnapshot {
		history = history == null ? List.of() : List.copyOf(history);
		episodic = episodic == null ? List.of() : List.copyOf(episodic);
		narrative = narrative == null ? "" : narrative;
	}

	public static MemorySnapshot empty() {
		return EMPTY;
	}

	public boolean hasNarrative() {
		return !narrative.isBlank();
	}
}
