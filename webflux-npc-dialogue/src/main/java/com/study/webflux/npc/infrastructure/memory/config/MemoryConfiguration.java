package com.study.webflux.npc.infrastructure.memory.config;

import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryDirectory;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryPort;
import com.study.webflux.npc.domain.memory.port.ShortTermMemoryPort;
import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;
import com.study.webflux.npc.infrastructure.memory.adapter.RedisShortTermMemoryAdapter;
import com.study.webflux.npc.infrastructure.memory.adapter.SpringAiEpisodicMemoryAdapter;

@Slf4j
@Configuration
public class MemoryConfiguration {

	@Bean
	public ShortTermMemoryPort shortTermMemoryPort(ReactiveStringRedisTemplate redisTemplate,
		ObjectMapper objectMapper,
		NpcDialogueProperties properties) {
		NpcDialogueProperties.Memory memory = properties.getMemory();
		return new RedisShortTermMemoryAdapter(redisTemplate,
			objectMapper,
			memory.getMaxHistory(),
			memory.getTtl());
	}

	/**
	 * {@code npc.dialogue.memory.episodic-npcs}에 등록된 NPC에만 장기 기억 저장소를 연결합니다.
	 */
	@Bean
	public EpisodicMemoryDirectory episodicMemoryDirectory(ObjectProvider<VectorStore> vectorStore,
		NpcDialogueProperties properties) {
		Set<NpcId> enabledNpcs = properties.getMemory().getEpisodicNpcs().stream()
			.map(NpcId::of)
			.collect(Collectors.toUnmodifiableSet());
		VectorStore store = vectorStore.getIfAvailable();
		if (store == null || enabledNpcs.isEmpty()) {
			log.info("장기 기억 저장소 비활성화 (vectorStore={}, npcs={})",
				store != null,
				enabledNpcs.size());
			return EpisodicMemoryDirectory.none();
		}
		CollaboratorBinding<EpisodicMemoryPort> binding = CollaboratorBinding
			.configured(new SpringAiEpisodicMemoryAdapter(store));
		return npcId -> enabledNpcs.contains(npcId) ? binding : CollaboratorBinding.unconfigured();
	}
}
