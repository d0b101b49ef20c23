package com.study.webflux.npc.infrastructure.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfiguration {

	@Bean
	public OpenAPI npcDialogueOpenApi(NpcDialogueProperties properties) {
		return new OpenAPI()
			.info(new Info()
				.title("NPC Dialogue API")
				.description(describe(properties))
				.version("0.1.0"));
	}

	static String describe(NpcDialogueProperties properties) {
		String npcs = properties.getNpcs().isEmpty()
			? "없음"
			: String.join(", ", properties.getNpcs().keySet());
		return "플레이어 발화 한 건을 NPC 응답 한 건으로 처리하는 대화 턴 API (등록된 NPC: " + npcs + ")";
	}
}
