package com.study.webflux.npc.infrastructure.common.config;

import java.util.List;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;

/**
 * 게임 클라이언트가 브라우저에서 {@code /npc/**} API를 호출할 때만 필요합니다. 허용 origin이 없으면 CORS 매핑을 등록하지 않습니다.
 */
@Configuration
@EnableConfigurationProperties(NpcDialogueProperties.class)
public class WebFluxCorsConfiguration implements WebFluxConfigurer {

	static final String[] NPC_API_METHODS = {"GET", "POST", "PUT", "DELETE"};

	private final List<String> allowedOrigins;

	public WebFluxCorsConfiguration(NpcDialogueProperties properties) {
		this.allowedOrigins = properties.getCors().getAllowedOrigins().stream()
			.map(String::trim)
			.filter(origin -> !origin.isBlank())
			.toList();
	}

	@Override
	public void addCorsMappings(CorsRegistry registry) {
		if (allowedOrigins.isEmpty()) {
			return;
		}
		registry.addMapping("/npc/**")
			.allowedOrigins(allowedOrigins.toArray(String[]::new))
			.allowedMethods(NPC_API_METHODS);
	}
}
