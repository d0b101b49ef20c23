package com.study.webflux.npc.application.agent;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import com.study.webflux.npc.domain.memory.model.MemorySnapshot;
import com.study.webflux.npc.fixture.ConversationContextFixture;
import com.study.webflux.npc.fixture.RecordingGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseGenerationAgentTest {

	private Clock clock;

	@BeforeEach
	void setUp() {
		clock = Clock.fixed(Instant.parse("2024-12-21T12:00:00Z"), ZoneOffset.UTC);
	}

	@Test
	@DisplayName("관계 블록, 기억 블록, 현재 대화 순서로 생성 입력을 구성한다")
	void compose_withMemoryNarrative_shouldOrderBlocks() {
		AffinitySnapshot affinity = AffinitySnapshot.of(80.0, "절친", "허물없이");
		MemorySnapshot memory = new MemorySnapshot(List.of(), List.of(), "【관련 기억】\n- 검 이야기");

		String composed = ResponseGenerationAgent.compose(affinity, memory, "안녕");

		assertThat(composed).isEqualTo(affinity.narrative()
			+ "【관련 기억】\n- 검 이야기\n\n"
			+ "【현재 대화】\n플레이어: 안녕");
	}

	@Test
	@DisplayName("기억 블록이 없으면 관계 블록 바로 뒤에 현재 대화가 온다")
	void compose_withoutMemoryNarrative_shouldSkipMemoryBlock() {
		String composed = ResponseGenerationAgent.compose(AffinitySnapshot.neutral(), MemorySnapshot.empty(), "hello");

		assertThat(composed).isEqualTo(AffinitySnapshot.neutral().narrative() + "【현재 대화】\n플레이어: hello");
	}

	@Test
	@DisplayName("병합된 기록과 생성 입력을 생성 협력자에 전달한다")
	void execute_shouldPassComposedInputAndHistory() {
		List<DialogueMessage> history = List.of(DialogueMessage.human("hi"), DialogueMessage.ai("yo"));
		ConversationContext context = ConversationContextFixture.create();
		context.applyMemory(new MemorySnapshot(history, List.of(), ""));
		context.applyAffinity(AffinitySnapshot.neutral());
		RecordingGenerator generator = RecordingGenerator.replying("  반갑다  ");
		ResponseGenerationAgent agent = new ResponseGenerationAgent(CollaboratorBinding.configured(generator), clock);

		StepVerifier.create(agent.execute(context))
			.assertNext(result -> {
				assertThat(result.success()).isTrue();
				assertThat(result.payload().reply()).isEqualTo("반갑다");
				assertThat(result.payload().composedInput()).isEqualTo(generator.lastComposedInput());
			})
			.verifyComplete();

		assertThat(generator.lastHistory()).containsExactlyElementsOf(history);
	}

	@Test
	@DisplayName("생성 협력자 오류는 실패 결과로 반환된다")
	void execute_whenGeneratorFails_shouldReturnFailure() {
		ResponseGenerationAgent agent = new ResponseGenerationAgent(
			CollaboratorBinding.configured(RecordingGenerator.failing(new IllegalStateException("timeout"))),
			clock);

		StepVerifier.create(agent.execute(ConversationContextFixture.merged()))
			.assertNext(result -> {
				assertThat(result.success()).isFalse();
				assertThat(result.error()).isEqualTo("timeout");
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("빈 응답은 생성 실패로 처리한다")
	void execute_whenReplyBlank_shouldReturnFailure() {
		ResponseGenerationAgent agent = new ResponseGenerationAgent(
			CollaboratorBinding.configured(RecordingGenerator.replying("   ")), clock);

		StepVerifier.create(agent.execute(ConversationContextFixture.merged()))
			.assertNext(result -> assertThat(result.success()).isFalse())
			.verifyComplete();
	}

	@Test
	@DisplayName("생성 협력자가 없으면 시뮬레이션 응답을 반환한다")
	void execute_withoutGenerator_shouldReturnSimulatedReply() {
		ResponseGenerationAgent agent = new ResponseGenerationAgent(CollaboratorBinding.unconfigured(), clock);

		StepVerifier.create(agent.execute(ConversationContextFixture.merged()))
			.assertNext(result -> {
				assertThat(result.success()).isTrue();
				assertThat(result.payload().reply()).isEqualTo("안녕하세요! 저는 브론입니다. (시뮬레이션 모드)");
			})
			.verifyComplete();
	}
}
