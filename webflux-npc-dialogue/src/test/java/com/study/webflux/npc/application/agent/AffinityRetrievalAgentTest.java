package com.study.webflux.npc.application.agent;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.affinity.port.RelationshipPort;
import com.study.webflux.npc.domain.agent.model.AgentResult;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.fixture.ConversationContextFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AffinityRetrievalAgentTest {

	@Mock
	private RelationshipPort relationshipPort;

	private Clock clock;
	private ConversationContext context;

	@BeforeEach
	void setUp() {
		clock = Clock.fixed(Instant.parse("2024-12-21T12:00:00Z"), ZoneOffset.UTC);
		context = ConversationContextFixture.create();
	}

	@Test
	@DisplayName("호감도 협력자가 있으면 점수와 단계로 관계 블록을 만든다")
	void execute_withRelationship_shouldFormatNarrative() {
		when(relationshipPort.getScore(context.npcId(), context.playerId())).thenReturn(Mono.just(72.4));
		when(relationshipPort.levelOf(72.4)).thenReturn("친근");
		when(relationshipPort.styleOf(72.4)).thenReturn("다정하게 말한다");
		AffinityRetrievalAgent agent = new AffinityRetrievalAgent(
			CollaboratorBinding.configured(relationshipPort), clock);

		StepVerifier.create(agent.execute(context))
			.assertNext(result -> {
				assertThat(result.success()).isTrue();
				assertThat(result.payload().score()).isEqualTo(72.4);
				assertThat(result.payload().narrative()).isEqualTo(
					"【현재 관계】\n플레이어와의 관계: 친근 (호감도: 72/100)\n【대화 스타일】다정하게 말한다\n\n");
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("호감도 협력자가 없으면 매번 같은 기본 관계를 반환한다")
	void execute_withoutRelationship_shouldReturnIdenticalNeutralSnapshot() {
		AffinityRetrievalAgent agent = new AffinityRetrievalAgent(CollaboratorBinding.unconfigured(), clock);

		AgentResult<AffinitySnapshot> first = agent.execute(context).block();
		AgentResult<AffinitySnapshot> second = agent.execute(ConversationContextFixture.create("again")).block();

		assertThat(first.success()).isTrue();
		assertThat(first.payload()).isEqualTo(AffinitySnapshot.neutral());
		assertThat(second.payload()).isEqualTo(first.payload());
		assertThat(first.payload().score()).isEqualTo(50.0);
		assertThat(first.payload().level()).isEqualTo("낯선 사이");
	}

	@Test
	@DisplayName("점수 조회 실패는 실패 결과로 반환된다")
	void execute_whenScoreLookupFails_shouldReturnFailure() {
		when(relationshipPort.getScore(context.npcId(), context.playerId()))
			.thenReturn(Mono.error(new IllegalStateException("redis down")));
		AffinityRetrievalAgent agent = new AffinityRetrievalAgent(
			CollaboratorBinding.configured(relationshipPort), clock);

		StepVerifier.create(agent.execute(context))
			.assertNext(result -> {
				assertThat(result.success()).isFalse();
				assertThat(result.error()).isEqualTo("redis down");
				assertThat(result.agentName()).isEqualTo("affinity_agent");
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("점수 조회가 빈 결과면 실패 결과로 반환된다")
	void execute_whenScoreLookupEmpty_shouldReturnFailure() {
		when(relationshipPort.getScore(context.npcId(), context.playerId())).thenReturn(Mono.empty());
		AffinityRetrievalAgent agent = new AffinityRetrievalAgent(
			CollaboratorBinding.configured(relationshipPort), clock);

		StepVerifier.create(agent.execute(context))
			.assertNext(result -> {
				assertThat(result.success()).isFalse();
				assertThat(result.error()).isEqualTo("affinity_agent produced no result");
			})
			.verifyComplete();
	}
}
