package com.study.webflux.npc.infrastructure.ambient.adapter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.npc.domain.ambient.port.AmbientLineGenerator;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.model.Message;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Mono;

/**
 * 등록된 모든 NPC의 배경 대사를 한 번의 LLM 호출로 생성합니다. 응답은 NPC ID를 키로 하는 JSON 객체여야 하며, 앞뒤에 다른 텍스트가
 * 붙어 있으면 첫 여는 중괄호부터 마지막 닫는 중괄호까지만 읽습니다. NPC가 하나라도 빠지면 해석 실패로 봅니다.
 */
@Slf4j
public class LlmAmbientLineAdapter implements AmbientLineGenerator {

	static final String SYSTEM_PROMPT = "너는 게임 마을 NPC들의 배경 대사를 쓰는 작가다. 요청한 JSON 객체 하나만 출력한다.";
	private static final double AMBIENT_TEMPERATURE = 0.7;
	private static final int LOG_PREVIEW_LENGTH = 100;

	private final LlmPort llmPort;
	private final FileBasedPromptTemplate promptTemplate;
	private final ObjectMapper objectMapper;
	private final String templateName;
	private final String model;
	private final Duration timeout;

	public LlmAmbientLineAdapter(LlmPort llmPort,
		FileBasedPromptTemplate promptTemplate,
		ObjectMapper objectMapper,
		String templateName,
		String model,
		Duration timeout) {
		this.llmPort = llmPort;
		this.promptTemplate = promptTemplate;
		this.objectMapper = objectMapper;
		this.templateName = templateName;
		this.model = model;
		this.timeout = timeout;
	}

	@Override
	public Mono<Map<NpcId, String>> generate(String scene, Map<NpcId, NpcProfile> npcs) {
		if (npcs.isEmpty()) {
			return Mono.just(Map.of());
		}
		return Mono.fromCallable(() -> buildPrompt(scene, npcs))
			.flatMap(prompt -> llmPort.complete(new CompletionRequest(
				List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)),
				model,
				AMBIENT_TEMPERATURE)))
			.timeout(timeout)
			.flatMap(response -> Mono.justOrEmpty(parse(response, npcs.keySet())));
	}

	String buildPrompt(String scene, Map<NpcId, NpcProfile> npcs) throws JsonProcessingException {
		String descriptions = npcs.entrySet().stream()
			.map(entry -> describe(entry.getKey(), entry.getValue()))
			.collect(Collectors.joining("\n"));
		Map<String, String> format = new LinkedHashMap<>();
		npcs.keySet().forEach(npcId -> format.put(npcId.value(), "..."));
		return promptTemplate.load(templateName, Map.of(
			"scene", scene,
			"count", String.valueOf(npcs.size()),
			"npcs", descriptions,
			"format", objectMapper.writeValueAsString(format))).trim();
	}

	Optional<Map<NpcId, String>> parse(String response, Set<NpcId> expected) {
		JsonNode root = readObject(response);
		if (root == null) {
			log.warn("배경 대사 응답을 해석할 수 없습니다: {}", preview(response));
			return Optional.empty();
		}
		Map<NpcId, String> lines = new LinkedHashMap<>();
		for (NpcId npcId : expected) {
			JsonNode line = root.get(npcId.value());
			if (line == null || !line.isTextual() || line.asText().isBlank()) {
				log.warn("배경 대사 응답에 NPC가 빠져 있습니다: npc={}, response={}", npcId.value(), preview(response));
				return Optional.empty();
			}
			lines.put(npcId, line.asText().strip());
		}
		return Optional.of(lines);
	}

	private JsonNode readObject(String response) {
		if (response == null || response.isBlank()) {
			return null;
		}
		JsonNode whole = readTree(response.strip());
		if (whole != null && whole.isObject()) {
			return whole;
		}
		int start = response.indexOf('{');
		int end = response.lastIndexOf('}');
		if (start < 0 || end <= start) {
			return null;
		}
		JsonNode embedded = readTree(response.substring(start, end + 1));
		return embedded != null && embedded.isObject() ? embedded : null;
	}

	private JsonNode readTree(String text) {
		try {
			return objectMapper.readTree(text);
		} catch (JsonProcessingException e) {
			log.debug("JSON 파싱 실패: {}", e.getOriginalMessage());
			return null;
		}
	}

	private String describe(NpcId npcId, NpcProfile profile) {
		StringBuilder builder = new StringBuilder("- ").append(npcId.value()).append(": ").append(profile.describe());
		if (!profile.location().isBlank()) {
			builder.append(", 위치: ").append(profile.location());
		}
		if (!profile.activity().isBlank()) {
			builder.append(", 하는 일: ").append(profile.activity());
		}
		return builder.toString();
	}

	private String preview(String response) {
		if (response == null) {
			return "";
		}
		return response.length() > LOG_PREVIEW_LENGTH
			? response.substring(0, LOG_PREVIEW_LENGTH) + "..."
			: response;
	}
}
