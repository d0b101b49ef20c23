package com.study.webflux.npc.application.dialogue.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.dialogue.model.ContextKey;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;

/**
 * 진행 중이거나 최근에 끝난 대화 컨텍스트를 보관합니다. 마지막 활동 후 유휴 시간이 지난 컨텍스트는 {@link #evictIdle()}에서 제거됩니다.
 */
@Slf4j
public class ConversationContextRegistry {

	private final Map<String, Entry> entries = new ConcurrentHashMap<>();
	private final Clock clock;
	private final Duration idleTimeout;

	public ConversationContextRegistry(Clock clock, Duration idleTimeout) {
		if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
			throw new IllegalArgumentException("idleTimeout must be positive");
		}
		this.clock = clock;
		this.idleTimeout = idleTimeout;
	}

	/**
	 * 새 턴의 컨텍스트를 생성해 등록합니다.
	 *
	 * @param npcId
	 *            NPC ID
	 * @param playerId
	 *            플레이어 ID
	 * @param utterance
	 *            플레이어 발화
	 * @param profile
	 *            NPC 역할 정보
	 * @return 등록된 컨텍스트
	 */
	public ConversationContext open(NpcId npcId,
		PlayerId playerId,
		String utterance,
		NpcProfile profile) {
		Instant now = clock.instant();
		Instant createdAt = now;
		while (true) {
			ContextKey key = new ContextKey(npcId, playerId, createdAt);
			ConversationContext context = ConversationContext.start(key, utterance, profile);
			// 같은 밀리초에 열린 턴은 1ms씩 밀어 키 충돌을 피한다
			if (entries.putIfAbsent(key.asString(), new Entry(context, now)) == null) {
				return context;
			}
			createdAt = createdAt.plusMillis(1);
		}
	}

	public Optional<ConversationContext> find(String contextId) {
		Entry entry = entries.get(contextId);
		return entry == null ? Optional.empty() : Optional.of(entry.context());
	}

	/** 컨텍스트의 마지막 활동 시각을 갱신합니다. */
	public void touch(ContextKey key) {
		Instant now = clock.instant();
		entries.computeIfPresent(key.asString(), (id, entry) -> new Entry(entry.context(), now));
	}

	public boolean remove(String contextId) {
		return entries.remove(contextId) != null;
	}

	/**
	 * 유휴 시간을 넘긴 컨텍스트를 제거합니다.
	 *
	 * @return 제거된 컨텍스트 수
	 */
	public int evictIdle() {
		Instant threshold = clock.instant().minus(idleTimeout);
		int evicted = 0;
		for (Map.Entry<String, Entry> entry : entries.entrySet()) {
			if (entry.getValue().lastActivity().isBefore(threshold)
				&& entries.remove(entry.getKey(), entry.getValue())) {
				evicted++;
			}
		}
		if (evicted > 0) {
			log.debug("유휴 대화 컨텍스트 {}개 제거", evicted);
		}
		return evicted;
	}

	public int size() {
		return entries.size();
	}

	private record Entry(ConversationContext context, Instant lastActivity) {
	}
}
