package com.study.webflux.npc.infrastructure.dialogue.adapter.llm;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.dialogue.port.ReplyReviewPort;
import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.model.Message;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Mono;

/** 검토 템플릿으로 LLM에 응답 검토를 요청하고 원문 판정을 반환합니다. */
public class LlmReplyReviewAdapter implements ReplyReviewPort {

	private static final double REVIEW_TEMPERATURE = 0.2;

	private final LlmPort llmPort;
	private final FileBasedPromptTemplate promptTemplate;
	private final String templateName;
	private final String model;
	private final Duration timeout;

	public LlmReplyReviewAdapter(LlmPort llmPort,
		FileBasedPromptTemplate promptTemplate,
		String templateName,
		String model,
		Duration timeout) {
		this.llmPort = llmPort;
		this.promptTemplate = promptTemplate;
		this.templateName = templateName;
		this.model = model;
		this.timeout = timeout;
	}

	@Override
	public Mono<String> review(String reply,
		String utterance,
		NpcProfile profile,
		String affinityLevel,
		String affinityStyle) {
		return Mono.fromCallable(() -> promptTemplate.load(templateName, Map.of(
			"name", profile.name(),
			"title", profile.title(),
			"personality", profile.personality(),
			"speakingStyle", profile.speakingStyle(),
			"utterance", utterance,
			"reply", reply,
			"affinityLevel", affinityLevel,
			"affinityStyle", affinityStyle)).trim())
			.flatMap(prompt -> llmPort.complete(new CompletionRequest(
				List.of(Message.user(prompt)),
				model,
				REVIEW_TEMPERATURE)))
			.timeout(timeout);
	}
}
