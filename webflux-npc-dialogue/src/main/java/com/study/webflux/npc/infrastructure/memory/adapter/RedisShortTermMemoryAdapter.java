package com.study.webflux.npc.infrastructure.memory.adapter;

import java.time.Duration;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import com.study.webflux.npc.domain.memory.model.SpeakerRole;
import com.study.webflux.npc.domain.memory.port.ShortTermMemoryPort;
import reactor.core.publisher.Mono;

/**
 * Redis 리스트에 최근 대화 기록을 JSON으로 저장합니다. 리스트는 최대 길이로 잘리고 TTL이 지나면 만료됩니다.
 */
@Slf4j
public class RedisShortTermMemoryAdapter implements ShortTermMemoryPort {

	private static final String KEY_PREFIX = "npc:short_term_memory:";

	private final ReactiveStringRedisTemplate redisTemplate;
	private final ObjectMapper objectMapper;
	private final int maxHistory;
	private final Duration ttl;

	public RedisShortTermMemoryAdapter(ReactiveStringRedisTemplate redisTemplate,
		ObjectMapper objectMapper,
		int maxHistory,
		Duration ttl) {
		this.redisTemplate = redisTemplate;
		this.objectMapper = objectMapper;
		this.maxHistory = maxHistory;
		this.ttl = ttl;
	}

	String keyFor(NpcId npcId, PlayerId playerId) {
		return KEY_PREFIX + npcId.value() + ":" + playerId.value();
	}

	@Override
	public Mono<List<DialogueMessage>> getHistory(NpcId npcId, PlayerId playerId) {
		return redisTemplate.opsForList()
			.range(keyFor(npcId, playerId), -maxHistory, -1)
			.concatMap(json -> Mono.justOrEmpty(decode(json)))
			.collectList();
	}

	@Override
	public Mono<Void> append(NpcId npcId, PlayerId playerId, DialogueMessage message) {
		String key = keyFor(npcId, playerId);
		return Mono.fromCallable(() -> encode(message))
			.flatMap(json -> redisTemplate.opsForList().rightPush(key, json))
			.flatMap(size -> redisTemplate.opsForList().trim(key, -maxHistory, -1))
			.then();
	}

	@Override
	public Mono<Void> extendExpiry(NpcId npcId, PlayerId playerId) {
		return redisTemplate.expire(keyFor(npcId, playerId), ttl).then();
	}

	@Override
	public Mono<Boolean> clear(NpcId npcId, PlayerId playerId) {
		return redisTemplate.delete(keyFor(npcId, playerId)).map(deleted -> deleted > 0);
	}

	private String encode(DialogueMessage message) throws JsonProcessingException {
		return objectMapper.writeValueAsString(
			new StoredMessage(message.role().getValue(), message.content()));
	}

	private DialogueMessage decode(String json) {
		try {
			StoredMessage stored = objectMapper.readValue(json, StoredMessage.class);
			return new DialogueMessage(SpeakerRole.fromValue(stored.role()), stored.content());
		} catch (JsonProcessingException | IllegalArgumentException e) {
			log.warn("손상된 대화 기록 항목을 건너뜁니다: {}", e.getMessage());
			return null;
		}
	}

	record StoredMessage(String role, String content) {
	}
}
