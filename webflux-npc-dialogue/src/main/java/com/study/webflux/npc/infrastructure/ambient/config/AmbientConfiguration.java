package com.study.webflux.npc.infrastructure.ambient.config;

import java.time.Clock;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.npc.application.ambient.AmbientDialogueService;
import com.study.webflux.npc.application.npc.NpcRoster;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.ambient.model.DayPeriod;
import com.study.webflux.npc.domain.ambient.port.AmbientLineGenerator;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.infrastructure.ambient.adapter.LlmAmbientLineAdapter;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;

@Configuration
public class AmbientConfiguration {

	@Bean
	public CollaboratorBinding<AmbientLineGenerator> ambientLineBinding(
		CollaboratorBinding<LlmPort> llmBinding,
		FileBasedPromptTemplate promptTemplate,
		ObjectMapper objectMapper,
		NpcDialogueProperties properties) {
		NpcDialogueProperties.Llm llm = properties.getLlm();
		return llmBinding.fold(
			llmPort -> CollaboratorBinding.configured(new LlmAmbientLineAdapter(llmPort,
				promptTemplate,
				objectMapper,
				properties.getTemplates().getAmbient(),
				llm.getModel(),
				llm.getTimeout())),
			CollaboratorBinding::unconfigured);
	}

	@Bean
	public AmbientDialogueService ambientDialogueService(
		CollaboratorBinding<AmbientLineGenerator> ambientLineBinding,
		NpcRoster npcRoster,
		NpcDialogueProperties properties,
		Clock clock) {
		NpcDialogueProperties.Ambient ambient = properties.getAmbient();
		return new AmbientDialogueService(ambientLineBinding,
			npcRoster,
			toPresets(ambient.getPresets()),
			clock,
			ZoneId.of(ambient.getZone()));
	}

	static Map<DayPeriod, Map<NpcId, String>> toPresets(Map<String, Map<String, String>> configured) {
		Map<DayPeriod, Map<NpcId, String>> presets = new EnumMap<>(DayPeriod.class);
		configured.forEach((periodKey, lines) -> {
			Map<NpcId, String> byNpc = new LinkedHashMap<>();
			lines.forEach((npcKey, line) -> byNpc.put(NpcId.of(npcKey), line));
			presets.put(DayPeriod.fromKey(periodKey), byNpc);
		});
		return presets;
	}
}
