package com.study.webflux.npc.domain.dialogue.model;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.memory.model.MemorySnapshot;
import com.study.webflux.npc.fixture.ConversationContextFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationContextTest {

	@Test
	@DisplayName("컨텍스트 ID는 NPC, 플레이어, 생성 시각 밀리초로 구성된다")
	void id_shouldJoinKeyParts() {
		ConversationContext context = ConversationContextFixture.create();

		assertThat(context.id())
			.isEqualTo("A_p1_" + ConversationContextFixture.CREATED_AT.toEpochMilli());
	}

	@Test
	@DisplayName("단계 출력은 한 번만 기록할 수 있다")
	void apply_twice_shouldThrow() {
		ConversationContext context = ConversationContextFixture.create();
		context.applyMemory(MemorySnapshot.empty());
		context.applyAffinity(AffinitySnapshot.neutral());
		context.applyDialogue(new GeneratedReply("hi", "composed"));
		context.applyRevision(RevisionOutcome.unchanged("hi", "PASS"));

		assertThatThrownBy(() -> context.applyMemory(MemorySnapshot.empty()))
			.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> context.applyAffinity(AffinitySnapshot.neutral()))
			.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> context.applyDialogue(new GeneratedReply("again", "composed")))
			.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> context.applyRevision(RevisionOutcome.unchanged("hi", "PASS")))
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("생성된 응답 없이 검토 결과를 기록할 수 없다")
	void applyRevision_withoutDialogue_shouldThrow() {
		ConversationContext context = ConversationContextFixture.merged();

		assertThatThrownBy(() -> context.applyRevision(RevisionOutcome.unchanged("hi", "PASS")))
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("최종 응답은 검토 결과가 있으면 검토된 응답이다")
	void finalReply_shouldPreferRevision() {
		ConversationContext context = ConversationContextFixture.generated("Hello traveler");
		assertThat(context.finalReply()).isEqualTo("Hello traveler");

		context.applyRevision(RevisionOutcome.revised("Hi there", "REVISED: Hi there", ""));

		assertThat(context.finalReply()).isEqualTo("Hi there");
	}

	@Test
	@DisplayName("응답이 생성되기 전에는 최종 응답을 읽을 수 없다")
	void finalReply_beforeGeneration_shouldThrow() {
		assertThatThrownBy(() -> ConversationContextFixture.merged().finalReply())
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("요약은 발화 앞 50자와 기록된 단계 출력을 보여준다")
	void summary_shouldPreviewUtteranceAndPresence() {
		String utterance = "가".repeat(60);
		ConversationContext context = ConversationContextFixture.create(utterance);
		context.applyMemory(MemorySnapshot.empty());

		ContextSummary summary = context.summary();

		assertThat(summary.utterancePreview()).hasSize(50);
		assertThat(summary.hasMemory()).isTrue();
		assertThat(summary.hasAffinity()).isFalse();
		assertThat(summary.hasDialogue()).isFalse();
		assertThat(summary.npcId()).isEqualTo("A");
		assertThat(summary.playerId()).isEqualTo("p1");
	}

	@Test
	@DisplayName("빈 발화로는 컨텍스트를 만들 수 없다")
	void start_withBlankUtterance_shouldThrow() {
		assertThatThrownBy(() -> ConversationContextFixture.create("  "))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("다른 스레드에서 기록한 단계 출력이 요약에 반영된다")
	void summary_afterWritesOnAnotherThread_shouldSeeOutputs() {
		ConversationContext context = ConversationContextFixture.create();

		Mono<ContextSummary> summary = Mono.fromRunnable(() -> {
			context.applyMemory(MemorySnapshot.empty());
			context.applyAffinity(AffinitySnapshot.neutral());
			context.applyDialogue(new GeneratedReply("hi", "composed"));
		})
			.subscribeOn(Schedulers.boundedElastic())
			.then(Mono.fromCallable(context::summary));

		StepVerifier.create(summary)
			.assertNext(result -> {
				assertThat(result.hasMemory()).isTrue();
				assertThat(result.hasAffinity()).isTrue();
				assertThat(result.hasDialogue()).isTrue();
				assertThat(result.hasRevision()).isFalse();
			})
			.verifyComplete();
	}
}
