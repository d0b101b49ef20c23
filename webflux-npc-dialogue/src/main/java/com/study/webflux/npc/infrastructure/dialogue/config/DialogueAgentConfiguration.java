package com.study.webflux.npc.infrastructure.dialogue.config;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.npc.application.agent.AffinityRetrievalAgent;
import com.study.webflux.npc.application.agent.AffinityUpdateAgent;
import com.study.webflux.npc.application.agent.MemoryPersistenceAgent;
import com.study.webflux.npc.application.agent.MemoryRetrievalAgent;
import com.study.webflux.npc.application.agent.ReplyRevisionAgent;
import com.study.webflux.npc.application.agent.ResponseGenerationAgent;
import com.study.webflux.npc.application.dialogue.context.ConversationContextRegistry;
import com.study.webflux.npc.application.dialogue.pipeline.DialogueSupervisor;
import com.study.webflux.npc.application.monitoring.TurnMetricsRecorder;
import com.study.webflux.npc.application.npc.NpcRoster;
import com.study.webflux.npc.application.npc.NpcStateService;
import com.study.webflux.npc.domain.affinity.port.RelationshipPort;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.dialogue.port.ReplyGenerationPort;
import com.study.webflux.npc.domain.dialogue.port.ReplyReviewPort;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryDirectory;
import com.study.webflux.npc.domain.memory.port.ShortTermMemoryPort;
import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;

/**
 * 대화 파이프라인의 단계와 감독자를 조립합니다. 협력자는 모두 이 설정에서 명시적으로 주입됩니다.
 */
@Configuration
public class DialogueAgentConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public NpcRoster npcRoster(NpcDialogueProperties properties,
		EpisodicMemoryDirectory episodicMemoryDirectory) {
		Map<NpcId, NpcProfile> profiles = new LinkedHashMap<>();
		properties.getNpcs().forEach((key, npc) -> profiles.put(NpcId.of(key), toProfile(key, npc)));
		return new NpcRoster(profiles, episodicMemoryDirectory);
	}

	@Bean
	public NpcStateService npcStateService(CollaboratorBinding<RelationshipPort> relationshipBinding,
		ShortTermMemoryPort shortTermMemoryPort,
		EpisodicMemoryDirectory episodicMemoryDirectory) {
		return new NpcStateService(relationshipBinding,
			shortTermMemoryPort,
			episodicMemoryDirectory);
	}

	@Bean
	public ConversationContextRegistry conversationContextRegistry(Clock clock,
		NpcDialogueProperties properties) {
		return new ConversationContextRegistry(clock, properties.getContext().getIdleTimeout());
	}

	@Bean
	public MemoryRetrievalAgent memoryRetrievalAgent(ShortTermMemoryPort shortTermMemoryPort,
		EpisodicMemoryDirectory episodicMemoryDirectory,
		NpcDialogueProperties properties,
		Clock clock) {
		return new MemoryRetrievalAgent(shortTermMemoryPort,
			episodicMemoryDirectory,
			properties.getMemory().getMaxHistory(),
			properties.getMemory().getEpisodicTopK(),
			clock);
	}

	@Bean
	public AffinityRetrievalAgent affinityRetrievalAgent(
		CollaboratorBinding<RelationshipPort> relationshipBinding,
		Clock clock) {
		return new AffinityRetrievalAgent(relationshipBinding, clock);
	}

	@Bean
	public ResponseGenerationAgent responseGenerationAgent(
		CollaboratorBinding<ReplyGenerationPort> replyGenerationBinding,
		Clock clock) {
		return new ResponseGenerationAgent(replyGenerationBinding, clock);
	}

	@Bean
	public ReplyRevisionAgent replyRevisionAgent(
		CollaboratorBinding<ReplyReviewPort> replyReviewBinding,
		NpcDialogueProperties properties,
		Clock clock) {
		return new ReplyRevisionAgent(replyReviewBinding,
			properties.getRevision().isEnabled(),
			clock);
	}

	@Bean
	public AffinityUpdateAgent affinityUpdateAgent(
		CollaboratorBinding<RelationshipPort> relationshipBinding,
		Clock clock) {
		return new AffinityUpdateAgent(relationshipBinding, clock);
	}

	@Bean
	public MemoryPersistenceAgent memoryPersistenceAgent(ShortTermMemoryPort shortTermMemoryPort,
		EpisodicMemoryDirectory episodicMemoryDirectory,
		Clock clock) {
		return new MemoryPersistenceAgent(shortTermMemoryPort, episodicMemoryDirectory, clock);
	}

	@Bean
	public DialogueSupervisor dialogueSupervisor(MemoryRetrievalAgent memoryRetrievalAgent,
		AffinityRetrievalAgent affinityRetrievalAgent,
		ResponseGenerationAgent responseGenerationAgent,
		ReplyRevisionAgent replyRevisionAgent,
		AffinityUpdateAgent affinityUpdateAgent,
		MemoryPersistenceAgent memoryPersistenceAgent,
		ConversationContextRegistry conversationContextRegistry,
		TurnMetricsRecorder turnMetricsRecorder,
		NpcDialogueProperties properties,
		Clock clock) {
		return new DialogueSupervisor(memoryRetrievalAgent,
			affinityRetrievalAgent,
			responseGenerationAgent,
			replyRevisionAgent,
			affinityUpdateAgent,
			memoryPersistenceAgent,
			conversationContextRegistry,
			turnMetricsRecorder,
			properties.getPipeline().isParallelRetrieval(),
			clock);
	}

	private NpcProfile toProfile(String key, NpcDialogueProperties.Npc npc) {
		String name = npc.getName() == null || npc.getName().isBlank() ? key : npc.getName();
		return new NpcProfile(name,
			npc.getTitle(),
			npc.getPersonality(),
			npc.getExpertise(),
			npc.getSpeakingStyle(),
			npc.getHobbies(),
			npc.getLocation(),
			npc.getActivity());
	}
}
