package com.study.webflux.npc.domain.affinity.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class AffinityLevelTest {

	@ParameterizedTest
	@CsvSource({"0, HOSTILE", "19.9, HOSTILE", "20, COLD", "40, STRANGER", "50, STRANGER", "60, FRIENDLY",
		"80, CLOSE", "100, CLOSE", "-5, HOSTILE"})
	@DisplayName("점수 구간에 맞는 관계 단계를 반환한다")
	void fromScore_shouldMatchBand(double score, AffinityLevel expected) {
		assertThat(AffinityLevel.fromScore(score)).isEqualTo(expected);
	}

	@Test
	@DisplayName("점수는 0에서 100 사이로 제한된다")
	void clamp_shouldBound() {
		assertThat(AffinityLevel.clamp(-3)).isEqualTo(0.0);
		assertThat(AffinityLevel.clamp(104)).isEqualTo(100.0);
		assertThat(AffinityLevel.clamp(42.5)).isEqualTo(42.5);
	}

	@Test
	@DisplayName("기본 관계는 처음 만난 사이의 점수와 스타일이다")
	void neutral_shouldMatchStranger() {
		AffinitySnapshot neutral = AffinitySnapshot.neutral();

		assertThat(neutral.score()).isEqualTo(50.0);
		assertThat(neutral.level()).isEqualTo(AffinityLevel.STRANGER.label());
		assertThat(neutral.style()).isEqualTo(AffinityLevel.STRANGER.style());
		assertThat(neutral.narrative()).isEqualTo("【현재 관계】\n플레이어와의 관계: 낯선 사이 (호감도: 50/100)\n"
			+ "【대화 스타일】예의 바르고 친절하게 대한다\n\n");
	}
}
