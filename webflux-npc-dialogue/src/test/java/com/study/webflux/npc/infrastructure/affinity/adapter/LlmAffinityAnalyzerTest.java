package com.study.webflux.npc.infrastructure.affinity.adapter;

import java.time.Duration;

import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.port.LlmPort;
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
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmAffinityAnalyzerTest {

	@Mock
	private LlmPort llmPort;

	private LlmAffinityAnalyzer analyzer;

	@BeforeEach
	void setUp() {
		analyzer = new LlmAffinityAnalyzer(llmPort,
			new FileBasedPromptTemplate(),
			"affinity-analysis",
			"gpt-4o-mini",
			10.0,
			Duration.ofSeconds(5));
	}

	@Test
	@DisplayName("대화 내용과 관계 단계를 담은 프롬프트로 변화량을 요청한다")
	void analyze_shouldSendPromptAndParseDelta() {
		when(llmPort.complete(any(CompletionRequest.class))).thenReturn(Mono.just("3"));

		StepVerifier.create(analyzer.analyze("브론", "검이 멋지네요", "고맙군", "낯선 사이"))
			.expectNext(3.0)
			.verifyComplete();

		ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
		verify(llmPort).complete(captor.capture());
		CompletionRequest request = captor.getValue();
		assertThat(request.model()).isEqualTo("gpt-4o-mini");
		assertThat(request.temperature()).isEqualTo(0.0);
		assertThat(request.messages()).hasSize(1);
		assertThat(request.messages().get(0).content())
			.contains("브론")
			.contains("검이 멋지네요")
			.contains("낯선 사이")
			.contains("-10부터 10");
	}

	@Test
	@DisplayName("응답의 첫 숫자를 읽고 최대 변화량으로 제한한다")
	void parseDelta_shouldClampFirstNumber() {
		assertThat(analyzer.parseDelta("+4")).isEqualTo(4.0);
		assertThat(analyzer.parseDelta("변화량: -7 정도")).isEqualTo(-7.0);
		assertThat(analyzer.parseDelta("25")).isEqualTo(10.0);
		assertThat(analyzer.parseDelta("-40")).isEqualTo(-10.0);
	}

	@Test
	@DisplayName("숫자가 없으면 변화 없음으로 처리한다")
	void parseDelta_withoutNumber_shouldReturnZero() {
		assertThat(analyzer.parseDelta("잘 모르겠습니다")).isZero();
		assertThat(analyzer.parseDelta(null)).isZero();
	}

	@Test
	@DisplayName("LLM 오류는 호출자에게 전파된다")
	void analyze_whenLlmFails_shouldPropagate() {
		when(llmPort.complete(any(CompletionRequest.class)))
			.thenReturn(Mono.error(new IllegalStateException("rate limited")));

		StepVerifier.create(analyzer.analyze("브론", "hello", "hi", "낯선 사이"))
			.expectErrorMessage("rate limited")
			.verify();
	}
}
