package com.study.webflux.npc.domain.affinity.model;

/**
 * 호감도 갱신 단계의 출력입니다. 갱신 실패는 턴 결과를 바꾸지 않고 {@code innerFault}로만 남습니다.
 */
public record AffinityChange(
	boolean changed,
	double previousScore,
	double newScore,
	double delta,
	String innerFault
) {
	public AffinityChange {
		innerFault = innerFault == null ? "" : innerFault;
	}

	public static AffinityChange of(double previousScore, double newScore) {
		double delta = newScore - previousScore;
		return new AffinityChange(delta != 0.0, previousScore, newScore, delta, "");
	}

	public static AffinityChange unchanged(double score) {
		return new AffinityChange(false, score, score, 0.0, "");
	}

	public static AffinityChange failed(double score, String fault) {
		return new AffinityChange(false, score, score, 0.0, fault);
	}

	public boolean hasFault() {
		return !innerFault.isBlank();
	}
}
