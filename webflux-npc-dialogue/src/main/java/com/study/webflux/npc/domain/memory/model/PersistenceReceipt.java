package com.study.webflux.npc.domain.memory.model;

/**
 * 기억 저장 단계의 출력입니다. 저장 실패는 턴 결과를 바꾸지 않고 {@code innerFault}로만 남습니다.
 */
public record PersistenceReceipt(
	boolean historyAppended,
	int episodicStored,
	String innerFault
) {
	public PersistenceReceipt {
		if (episodicStored < 0) {
			throw new IllegalArgumentException("episodicStored cannot be negative");
		}
		innerFault = innerFault == null ? "" : innerFault;
	}

	public boolean hasFault() {
		return !innerFault.isBlank();
	}
}
