package com.study.webflux.npc.application.agent;

import com.study.webflux.npc.domain.dialogue.model.RevisionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewVerdictTest {

	private static final String ORIGINAL = "Hello traveler";

	@ParameterizedTest
	@ValueSource(strings = {"PASS", "  PASS  ", "PASS\n"})
	@DisplayName("승인 판정이면 원래 응답을 유지한다")
	void interpret_approval_shouldKeepOriginal(String verdict) {
		RevisionOutcome outcome = ReviewVerdict.interpret(verdict, ORIGINAL);

		assertThat(outcome.finalReply()).isEqualTo(ORIGINAL);
		assertThat(outcome.revised()).isFalse();
		assertThat(outcome.hasNote()).isFalse();
	}

	@Test
	@DisplayName("REVISED 판정이면 접두어를 제거한 응답으로 교체한다")
	void interpret_markedRevision_shouldStripMarker() {
		RevisionOutcome outcome = ReviewVerdict.interpret("REVISED: Hi there", ORIGINAL);

		assertThat(outcome.finalReply()).isEqualTo("Hi there");
		assertThat(outcome.revised()).isTrue();
		assertThat(outcome.verdict()).isEqualTo("REVISED: Hi there");
		assertThat(outcome.hasNote()).isFalse();
	}

	@Test
	@DisplayName("접두어 뒤가 비어 있으면 원래 응답을 유지한다")
	void interpret_emptyRevision_shouldKeepOriginal() {
		RevisionOutcome outcome = ReviewVerdict.interpret("REVISED:   ", ORIGINAL);

		assertThat(outcome.finalReply()).isEqualTo(ORIGINAL);
		assertThat(outcome.revised()).isFalse();
	}

	@Test
	@DisplayName("마커 없는 판정은 판정 전체로 교체하고 진단 메모를 남긴다")
	void interpret_unmarkedVerdict_shouldUseVerbatimWithNote() {
		RevisionOutcome outcome = ReviewVerdict.interpret("Greetings, friend.", ORIGINAL);

		assertThat(outcome.finalReply()).isEqualTo("Greetings, friend.");
		assertThat(outcome.revised()).isTrue();
		assertThat(outcome.note()).isEqualTo(ReviewVerdict.UNMARKED_NOTE);
		assertThat(outcome.reviewFailed()).isFalse();
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "   "})
	@DisplayName("빈 판정은 원래 응답을 유지한다")
	void interpret_blankVerdict_shouldKeepOriginal(String verdict) {
		RevisionOutcome outcome = ReviewVerdict.interpret(verdict, ORIGINAL);

		assertThat(outcome.finalReply()).isEqualTo(ORIGINAL);
		assertThat(outcome.revised()).isFalse();
	}

	@Test
	@DisplayName("소문자 pass는 승인으로 보지 않는다")
	void interpret_lowercasePass_shouldNotApprove() {
		RevisionOutcome outcome = ReviewVerdict.interpret("pass", ORIGINAL);

		assertThat(outcome.revised()).isTrue();
		assertThat(outcome.finalReply()).isEqualTo("pass");
	}
}
