package com.study.webflux.npc.infrastructure.dialogue.adapter.llm;

import java.time.Duration;

import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.fixture.NpcProfileFixture;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
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
class LlmReplyReviewAdapterTest {

	@Mock
	private LlmPort llmPort;

	@Test
	@DisplayName("응답과 관계 정보를 검토 템플릿에 담아 원문 판정을 반환한다")
	void review_shouldReturnRawVerdict() {
		LlmReplyReviewAdapter adapter = new LlmReplyReviewAdapter(llmPort,
			new FileBasedPromptTemplate(),
			"reply-review",
			"gpt-4o-mini",
			Duration.ofSeconds(5));
		when(llmPort.complete(any(CompletionRequest.class))).thenReturn(Mono.just("REVISED: 어서 오게."));

		StepVerifier.create(adapter.review("안녕하세요 고객님", "안녕", NpcProfileFixture.create(),
			"낯선 사이", "예의 바르고 친절하게 대한다"))
			.expectNext("REVISED: 어서 오게.")
			.verifyComplete();

		ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
		verify(llmPort).complete(captor.capture());
		CompletionRequest request = captor.getValue();
		assertThat(request.temperature()).isEqualTo(0.2);
		assertThat(request.messages().get(0).content())
			.contains("NPC 응답: 안녕하세요 고객님")
			.contains("관계 단계: 낯선 사이")
			.contains("이름: 브론");
	}
}
