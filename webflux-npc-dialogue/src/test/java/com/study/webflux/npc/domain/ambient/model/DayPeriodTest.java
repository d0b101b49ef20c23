package com.study.webflux.npc.domain.ambient.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DayPeriodTest {

	@ParameterizedTest
	@CsvSource({"6, MORNING", "11, MORNING", "12, NOON", "13, NOON", "14, AFTERNOON", "17, AFTERNOON", "18, EVENING",
		"23, EVENING", "0, EVENING", "5, EVENING"})
	@DisplayName("시각에 맞는 시간대를 반환한다")
	void ofHour_shouldMatchBand(int hour, DayPeriod expected) {
		assertThat(DayPeriod.ofHour(hour)).isEqualTo(expected);
	}

	@Test
	@DisplayName("범위를 벗어난 시각은 예외가 발생한다")
	void ofHour_outOfRange_shouldThrow() {
		assertThatThrownBy(() -> DayPeriod.ofHour(24)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("설정 키로 시간대를 찾는다")
	void fromKey_shouldIgnoreCase() {
		assertThat(DayPeriod.fromKey("Afternoon")).isEqualTo(DayPeriod.AFTERNOON);
		assertThatThrownBy(() -> DayPeriod.fromKey("dawn")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("장면 설명은 시간대보다 세분화된 구간을 따른다")
	void scene_shouldFollowFinerBands() {
		assertThat(AmbientScene.at(7)).startsWith("이른 아침");
		assertThat(AmbientScene.at(10)).startsWith("오전");
		assertThat(AmbientScene.at(18)).startsWith("해 질 녘");
		assertThat(AmbientScene.at(2)).startsWith("밤");
	}
}
