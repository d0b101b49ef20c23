package com.study.webflux.npc.infrastructure.common.config;

import java.util.List;
import java.util.Map;

import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.reactive.config.CorsRegistry;

import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebFluxCorsConfigurationTest {

	@Test
	@DisplayName("허용 origin이 없으면 CORS 매핑을 등록하지 않는다")
	void addCorsMappings_withoutOrigins_shouldRegisterNothing() {
		InspectableCorsRegistry registry = new InspectableCorsRegistry();

		new WebFluxCorsConfiguration(propertiesWith(List.of(" ", ""))).addCorsMappings(registry);

		assertThat(registry.configurations()).isEmpty();
	}

	@Test
	@DisplayName("NPC API 경로에만 설정된 origin과 API 메서드를 허용한다")
	void addCorsMappings_shouldAllowNpcApiOnly() {
		InspectableCorsRegistry registry = new InspectableCorsRegistry();

		new WebFluxCorsConfiguration(propertiesWith(List.of(" https://game.example.com ")))
			.addCorsMappings(registry);

		assertThat(registry.configurations()).containsOnlyKeys("/npc/**");
		CorsConfiguration configuration = registry.configurations().get("/npc/**");
		assertThat(configuration.getAllowedOrigins()).containsExactly("https://game.example.com");
		assertThat(configuration.getAllowedMethods()).containsExactly("GET", "POST", "PUT", "DELETE");
	}

	private NpcDialogueProperties propertiesWith(List<String> origins) {
		NpcDialogueProperties properties = new NpcDialogueProperties();
		properties.getCors().setAllowedOrigins(origins);
		return properties;
	}

	private static class InspectableCorsRegistry extends CorsRegistry {

		Map<String, CorsConfiguration> configurations() {
			return getCorsConfigurations();
		}
	}
}
