package com.study.webflux.npc.application.dialogue.context;

import java.time.Duration;
import java.time.Instant;

import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import com.study.webflux.npc.fixture.MutableClock;
import com.study.webflux.npc.fixture.NpcProfileFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationContextRegistryTest {

	private static final Instant START = Instant.parse("2024-12-21T12:00:00Z");
	private static final NpcId NPC = NpcId.of("blacksmith");
	private static final PlayerId PLAYER = PlayerId.of("p1");

	private MutableClock clock;
	private ConversationContextRegistry registry;

	@BeforeEach
	void setUp() {
		clock = MutableClock.at(START);
		registry = new ConversationContextRegistry(clock, Duration.ofMinutes(5));
	}

	@Test
	@DisplayName("열린 컨텍스트는 ID로 조회할 수 있다")
	void open_shouldRegisterContext() {
		ConversationContext context = registry.open(NPC, PLAYER, "hello", NpcProfileFixture.create());

		assertThat(context.id()).isEqualTo("blacksmith_p1_" + START.toEpochMilli());
		assertThat(registry.find(context.id())).containsSame(context);
		assertThat(registry.size()).isEqualTo(1);
	}

	@Test
	@DisplayName("같은 시각에 열린 턴은 서로 다른 ID를 받는다")
	void open_sameInstant_shouldAvoidKeyCollision() {
		ConversationContext first = registry.open(NPC, PLAYER, "hello", NpcProfileFixture.create());
		ConversationContext second = registry.open(NPC, PLAYER, "again", NpcProfileFixture.create());

		assertThat(second.id()).isNotEqualTo(first.id());
		assertThat(second.createdAt()).isEqualTo(START.plusMillis(1));
		assertThat(registry.size()).isEqualTo(2);
	}

	@Test
	@DisplayName("유휴 시간을 넘긴 컨텍스트만 제거한다")
	void evictIdle_shouldRemoveExpiredContexts() {
		ConversationContext stale = registry.open(NPC, PLAYER, "hello", NpcProfileFixture.create());
		clock.advance(Duration.ofMinutes(3));
		ConversationContext fresh = registry.open(NPC, PlayerId.of("p2"), "hi", NpcProfileFixture.create());
		clock.advance(Duration.ofMinutes(3));

		int evicted = registry.evictIdle();

		assertThat(evicted).isEqualTo(1);
		assertThat(registry.find(stale.id())).isEmpty();
		assertThat(registry.find(fresh.id())).isPresent();
	}

	@Test
	@DisplayName("활동을 갱신한 컨텍스트는 제거되지 않는다")
	void touch_shouldExtendLifetime() {
		ConversationContext context = registry.open(NPC, PLAYER, "hello", NpcProfileFixture.create());
		clock.advance(Duration.ofMinutes(4));
		registry.touch(context.key());
		clock.advance(Duration.ofMinutes(4));

		assertThat(registry.evictIdle()).isZero();
		assertThat(registry.find(context.id())).isPresent();
	}

	@Test
	@DisplayName("컨텍스트를 직접 제거할 수 있다")
	void remove_shouldDeleteContext() {
		ConversationContext context = registry.open(NPC, PLAYER, "hello", NpcProfileFixture.create());

		assertThat(registry.remove(context.id())).isTrue();
		assertThat(registry.remove(context.id())).isFalse();
		assertThat(registry.size()).isZero();
	}

	@Test
	@DisplayName("유휴 시간은 양수여야 한다")
	void constructor_withNonPositiveTimeout_shouldThrow() {
		assertThatThrownBy(() -> new ConversationContextRegistry(clock, Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
