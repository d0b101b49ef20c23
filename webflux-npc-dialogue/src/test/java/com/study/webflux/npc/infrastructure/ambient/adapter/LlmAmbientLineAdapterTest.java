package com.study.webflux.npc.infrastructure.ambient.adapter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.model.MessageRole;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.fixture.NpcProfileFixture;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmAmbientLineAdapterTest {

	private static final NpcId BLACKSMITH = NpcId.of("blacksmith");
	private static final NpcId MERCHANT = NpcId.of("merchant");

	@Mock
	private LlmPort llmPort;

	private LlmAmbientLineAdapter adapter;
	private Map<NpcId, NpcProfile> npcs;

	@BeforeEach
	void setUp() {
		adapter = new LlmAmbientLineAdapter(llmPort,
			new FileBasedPromptTemplate(),
			new ObjectMapper(),
			"ambient-batch",
			"gpt-4o-mini",
			Duration.ofSeconds(5));
		npcs = new LinkedHashMap<>();
		npcs.put(BLACKSMITH, NpcProfileFixture.create());
		npcs.put(MERCHANT, NpcProfileFixture.create("카이"));
	}

	@Test
	@DisplayName("모든 NPC 정보를 담은 한 번의 요청으로 대사를 생성한다")
	void generate_shouldSendSingleBatchRequest() {
		when(llmPort.complete(any(CompletionRequest.class))).thenReturn(Mono.just("""
			{"blacksmith": " 이 칼날, 한 번 더 달궈야겠어. ", "merchant": "싸게 줄게, 구경하고 가!"}
			"""));

		StepVerifier.create(adapter.generate("해 질 녘 광장", npcs))
			.assertNext(lines -> assertThat(lines).containsExactly(
				Map.entry(BLACKSMITH, "이 칼날, 한 번 더 달궈야겠어."),
				Map.entry(MERCHANT, "싸게 줄게, 구경하고 가!")))
			.verifyComplete();

		ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
		verify(llmPort).complete(captor.capture());
		CompletionRequest request = captor.getValue();
		assertThat(request.model()).isEqualTo("gpt-4o-mini");
		assertThat(request.temperature()).isEqualTo(0.7);
		assertThat(request.messages()).hasSize(2);
		assertThat(request.messages().get(0).role()).isEqualTo(MessageRole.SYSTEM);
		assertThat(request.messages().get(1).content())
			.contains("【장면】해 질 녘 광장")
			.contains("NPC 2명")
			.contains("- blacksmith: 브론 (대장장이)")
			.contains("하는 일: 검을 담금질하는 중")
			.contains("- merchant: 카이")
			.contains("{\"blacksmith\":\"...\",\"merchant\":\"...\"}")
			.doesNotContain("{{");
	}

	@Test
	@DisplayName("JSON 앞뒤에 설명이 붙어 있어도 객체 부분만 읽는다")
	void generate_withSurroundingText_shouldExtractObject() {
		when(llmPort.complete(any(CompletionRequest.class))).thenReturn(Mono.just("""
			대사를 만들었습니다.
			```json
			{"blacksmith": "불부터 올리자.", "merchant": "좌판 펴자!"}
			```
			"""));

		StepVerifier.create(adapter.generate("아침", npcs))
			.assertNext(lines -> assertThat(lines)
				.containsEntry(BLACKSMITH, "불부터 올리자.")
				.containsEntry(MERCHANT, "좌판 펴자!"))
			.verifyComplete();
	}

	@Test
	@DisplayName("NPC가 하나라도 빠진 응답은 해석 실패로 본다")
	void generate_withMissingNpc_shouldCompleteEmpty() {
		when(llmPort.complete(any(CompletionRequest.class)))
			.thenReturn(Mono.just("{\"blacksmith\": \"불부터 올리자.\", \"merchant\": \"  \"}"));

		StepVerifier.create(adapter.generate("아침", npcs)).verifyComplete();
	}

	@Test
	@DisplayName("JSON 객체가 아닌 응답은 해석 실패로 본다")
	void parse_withNonObject_shouldBeEmpty() {
		assertThat(adapter.parse("그냥 평범한 하루네요.", npcs.keySet())).isEmpty();
		assertThat(adapter.parse("[\"불부터 올리자.\"]", npcs.keySet())).isEmpty();
		assertThat(adapter.parse("{ 깨진 json", npcs.keySet())).isEmpty();
		assertThat(adapter.parse(null, npcs.keySet())).isEmpty();
	}

	@Test
	@DisplayName("LLM 호출 실패는 그대로 전파한다")
	void generate_whenLlmFails_shouldPropagateError() {
		when(llmPort.complete(any(CompletionRequest.class)))
			.thenReturn(Mono.error(new IllegalStateException("rate limited")));

		StepVerifier.create(adapter.generate("아침", npcs))
			.expectErrorMessage("rate limited")
			.verify();
	}

	@Test
	@DisplayName("대상 NPC가 없으면 LLM을 호출하지 않는다")
	void generate_withNoNpcs_shouldSkipCall() {
		StepVerifier.create(adapter.generate("아침", Map.of()))
			.expectNext(Map.of())
			.verifyComplete();

		verifyNoInteractions(llmPort);
	}
}
