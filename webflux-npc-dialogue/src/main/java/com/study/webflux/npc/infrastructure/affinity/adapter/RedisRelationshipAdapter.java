package com.study.webflux.npc.infrastructure.affinity.adapter;

import java.util.Map;

import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import com.study.webflux.npc.domain.affinity.model.AffinityChange;
import com.study.webflux.npc.domain.affinity.model.AffinityLevel;
import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.affinity.port.RelationshipPort;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import reactor.core.publisher.Mono;

/**
 * Redis에 NPC-플레이어별 호감도를 저장합니다. 기록이 없는 관계는 {@link AffinitySnapshot#NEUTRAL_SCORE}로 시작합니다.
 *
 * <p>
 * 변화량 분석기가 없으면 대화 후에도 호감도는 바뀌지 않습니다.
 */
public class RedisRelationshipAdapter implements RelationshipPort {

	private static final String KEY_PREFIX = "npc:affinity:";

	private final ReactiveStringRedisTemplate redisTemplate;
	private final CollaboratorBinding<LlmAffinityAnalyzer> analyzer;
	private final Map<NpcId, String> npcNames;

	public RedisRelationshipAdapter(ReactiveStringRedisTemplate redisTemplate,
		CollaboratorBinding<LlmAffinityAnalyzer> analyzer,
		Map<NpcId, String> npcNames) {
		this.redisTemplate = redisTemplate;
		this.analyzer = analyzer;
		this.npcNames = Map.copyOf(npcNames);
	}

	String keyFor(NpcId npcId, PlayerId playerId) {
		return KEY_PREFIX + npcId.value() + ":" + playerId.value();
	}

	@Override
	public Mono<Double> getScore(NpcId npcId, PlayerId playerId) {
		return redisTemplate.opsForValue()
			.get(keyFor(npcId, playerId))
			.map(Double::parseDouble)
			.defaultIfEmpty(AffinitySnapshot.NEUTRAL_SCORE);
	}

	@Override
	public String levelOf(double score) {
		return AffinityLevel.fromScore(score).label();
	}

	@Override
	public String styleOf(double score) {
		return AffinityLevel.fromScore(score).style();
	}

	@Override
	public Mono<AffinityChange> analyzeAndUpdate(NpcId npcId,
		PlayerId playerId,
		String utterance,
		String reply) {
		return getScore(npcId, playerId).flatMap(current -> analyzer.fold(
			affinityAnalyzer -> affinityAnalyzer
				.analyze(npcNames.getOrDefault(npcId, npcId.value()),
					utterance,
					reply,
					levelOf(current))
				.flatMap(delta -> apply(npcId, playerId, current, delta)),
			() -> Mono.just(AffinityChange.unchanged(current))));
	}

	@Override
	public Mono<Double> setScore(NpcId npcId, PlayerId playerId, double score) {
		double clamped = AffinityLevel.clamp(score);
		return store(npcId, playerId, clamped).thenReturn(clamped);
	}

	private Mono<AffinityChange> apply(NpcId npcId,
		PlayerId playerId,
		double current,
		double delta) {
		double updated = AffinityLevel.clamp(current + delta);
		if (updated == current) {
			return Mono.just(AffinityChange.unchanged(current));
		}
		return store(npcId, playerId, updated).thenReturn(AffinityChange.of(current, updated));
	}

	private Mono<Boolean> store(NpcId npcId, PlayerId playerId, double score) {
		return redisTemplate.opsForValue().set(keyFor(npcId, playerId), Double.toString(score));
	}
}
