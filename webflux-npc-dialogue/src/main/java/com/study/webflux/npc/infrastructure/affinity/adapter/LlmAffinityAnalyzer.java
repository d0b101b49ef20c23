package com.study.webflux.npc.infrastructure.affinity.adapter;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.model.Message;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Mono;

/**
 * 한 번의 대화가 호감도에 미치는 변화량을 LLM으로 판단합니다. 응답에서 첫 번째 정수를 읽고 {@code ±maxDelta}로 제한합니다.
 */
@Slf4j
public class LlmAffinityAnalyzer {

	private static final Pattern SIGNED_NUMBER = Pattern.compile("[-+]?\\d+(\\.\\d+)?");
	private static final double ANALYSIS_TEMPERATURE = 0.0;

	private final LlmPort llmPort;
	private final FileBasedPromptTemplate promptTemplate;
	private final String templateName;
	private final String model;
	private final double maxDelta;
	private final Duration timeout;

	public LlmAffinityAnalyzer(LlmPort llmPort,
		FileBasedPromptTemplate promptTemplate,
		String templateName,
		String model,
		double maxDelta,
		Duration timeout) {
		this.llmPort = llmPort;
		this.promptTemplate = promptTemplate;
		this.templateName = templateName;
		this.model = model;
		this.maxDelta = maxDelta;
		this.timeout = timeout;
	}

	/**
	 * @return 호감도 변화량 ({@code -maxDelta ~ +maxDelta})
	 */
	public Mono<Double> analyze(String npcName,
		String utterance,
		String reply,
		String currentLevel) {
		return Mono.fromCallable(() -> promptTemplate.load(templateName, Map.of(
			"name", npcName,
			"utterance", utterance,
			"reply", reply,
			"affinityLevel", currentLevel,
			"maxDelta", String.format(Locale.ROOT, "%.0f", maxDelta))).trim())
			.flatMap(prompt -> llmPort.complete(new CompletionRequest(
				List.of(Message.user(prompt)),
				model,
				ANALYSIS_TEMPERATURE)))
			.timeout(timeout)
			.map(this::parseDelta);
	}

	double parseDelta(String response) {
		Matcher matcher = SIGNED_NUMBER.matcher(response == null ? "" : response);
		if (!matcher.find()) {
			log.debug("호감도 분석 응답에서 숫자를 찾지 못해 변화 없음으로 처리: {}", response);
			return 0.0;
		}
		double delta = Double.parseDouble(matcher.group());
		return Math.max(-maxDelta, Math.min(maxDelta, delta));
	}
}
