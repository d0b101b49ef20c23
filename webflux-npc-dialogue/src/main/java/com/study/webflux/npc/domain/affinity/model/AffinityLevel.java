package com.study.webflux.npc.domain.affinity.model;

/** 호감도 점수 구간별 관계 단계와 대화 스타일입니다. */
public enum AffinityLevel {
	/** 0 이상 20 미만 */
	HOSTILE(0, "적대", "차갑고 경계하는 말투로 짧게 대답한다"),

	/** 20 이상 40 미만 */
	COLD(20, "냉담", "사무적이고 거리를 두는 말투를 쓴다"),

	/** 40 이상 60 미만. 처음 만난 플레이어의 기본 단계입니다. */
	STRANGER(40, "낯선 사이", "예의 바르고 친절하게 대한다"),

	/** 60 이상 80 미만 */
	FRIENDLY(60, "친근", "편안하고 다정한 말투로 먼저 말을 건넨다"),

	/** 80 이상 */
	CLOSE(80, "절친", "허물없이 농담을 섞어 이야기한다");

	public static final double MIN_SCORE = 0.0;
	public static final double MAX_SCORE = 100.0;

	private final double lowerBound;
	private final String label;
	private final String style;

	AffinityLevel(double lowerBound, String label, String style) {
		this.lowerBound = lowerBound;
		this.label = label;
		this.style = style;
	}

	public String label() {
		return label;
	}

	public String style() {
		return style;
	}

	public static AffinityLevel fromScore(double score) {
		AffinityLevel matched = HOSTILE;
		for (AffinityLevel level : values()) {
			if (score >= level.lowerBound) {
				matched = level;
			}
		}
		return matched;
	}

	public static double clamp(double score) {
		return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
	}
}
