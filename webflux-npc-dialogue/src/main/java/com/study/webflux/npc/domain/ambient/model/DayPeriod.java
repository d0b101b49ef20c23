package com.study.webflux.npc.domain.ambient.model;

/**
 * 기본 대사 묶음을 고르는 시간대입니다.
 */
public enum DayPeriod {
	MORNING("morning"),
	NOON("noon"),
	AFTERNOON("afternoon"),
	EVENING("evening");

	private final String key;

	DayPeriod(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	/**
	 * 6~12시는 아침, 12~14시는 점심, 14~18시는 오후, 나머지는 저녁입니다.
	 */
	public static DayPeriod ofHour(int hour) {
		if (hour < 0 || hour > 23) {
			throw new IllegalArgumentException("hour must be between 0 and 23: " + hour);
		}
		if (hour >= 6 && hour < 12) {
			return MORNING;
		}
		if (hour >= 12 && hour < 14) {
			return NOON;
		}
		if (hour >= 14 && hour < 18) {
			return AFTERNOON;
		}
		return EVENING;
	}

	public static DayPeriod fromKey(String key) {
		for (DayPeriod period : values()) {
			if (period.key.equalsIgnoreCase(key)) {
				return period;
			}
		}
		throw new IllegalArgumentException("Unknown day period: " + key);
	}
}
