package com.study.webflux.npc.infrastructure.affinity.config;

import lombok.extern.slf4j.Slf4j;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import com.study.webflux.npc.application.npc.NpcRoster;
import com.study.webflux.npc.domain.affinity.port.RelationshipPort;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.infrastructure.affinity.adapter.LlmAffinityAnalyzer;
import com.study.webflux.npc.infrastructure.affinity.adapter.RedisRelationshipAdapter;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;

@Slf4j
@Configuration
public class AffinityConfiguration {

	@Bean
	public CollaboratorBinding<RelationshipPort> relationshipBinding(
		ReactiveStringRedisTemplate redisTemplate,
		CollaboratorBinding<LlmPort> llmBinding,
		FileBasedPromptTemplate promptTemplate,
		NpcRoster npcRoster,
		NpcDialogueProperties properties) {
		NpcDialogueProperties.Affinity affinity = properties.getAffinity();
		if (!affinity.isEnabled()) {
			log.info("호감도 시스템 비활성화, 모든 대화는 기본 관계로 진행됩니다");
			return CollaboratorBinding.unconfigured();
		}
		CollaboratorBinding<LlmAffinityAnalyzer> analyzer = llmBinding.fold(
			llmPort -> CollaboratorBinding.configured(new LlmAffinityAnalyzer(llmPort,
				promptTemplate,
				properties.getTemplates().getAffinity(),
				properties.getLlm().getModel(),
				affinity.getMaxDelta(),
				properties.getLlm().getTimeout())),
			CollaboratorBinding::unconfigured);
		return CollaboratorBinding.configured(
			new RedisRelationshipAdapter(redisTemplate, analyzer, npcRoster.names()));
	}
}
