package com.study.webflux.npc.domain.affinity.model;

import java.util.Locale;

/**
 * 호감도 조회 단계의 출력입니다.
 *
 * @param score
 *            현재 호감도 (0~100)
 * @param level
 *            관계 단계 이름
 * @param style
 *            대화 스타일 지시문
 * @param narrative
 *            생성 입력에 주입할 관계 블록
 */
public record AffinitySnapshot(
	double score,
	String level,
	String style,
	String narrative
) {
	public static final double NEUTRAL_SCORE = 50.0;

	private static final AffinitySnapshot NEUTRAL = of(NEUTRAL_SCORE,
		AffinityLevel.STRANGER.label(),
		AffinityLevel.STRANGER.style());

	public AffinitySnapshot {
		if (level == null || level.isBlank()) {
			throw new IllegalArgumentException("level cannot be null or blank");
		}
		style = style == null ? "" : style;
		narrative = narrative == null ? "" : narrative;
	}

	public static AffinitySnapshot of(double score, String level, String style) {
		return new AffinitySnapshot(score, level, style, describe(score, level, style));
	}

	/**
	 * 한 번도 대화하지 않은 관계와 동일한 기본값입니다.
	 */
	public static AffinitySnapshot neutral() {
		return NEUTRAL;
	}

	private static String describe(double score, String level, String style) {
		return "【현재 관계】\n"
			+ "플레이어와의 관계: " + level + " (호감도: " + String.format(Locale.ROOT, "%.0f", score) + "/100)\n"
			+ "【대화 스타일】" + (style == null ? "" : style) + "\n\n";
	}
}
