package com.study.webflux.npc.infrastructure.dialogue.adapter.llm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.dialogue.port.ReplyGenerationPort;
import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.model.Message;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import com.study.webflux.npc.domain.memory.model.SpeakerRole;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Mono;

/**
 * NPC 페르소나 시스템 프롬프트, 최근 대화 기록, 합성 입력 순서로 메시지를 구성해 응답을 생성합니다.
 */
public class LlmReplyGenerationAdapter implements ReplyGenerationPort {

	private final LlmPort llmPort;
	private final FileBasedPromptTemplate promptTemplate;
	private final String templateName;
	private final String model;
	private final Duration timeout;

	public LlmReplyGenerationAdapter(LlmPort llmPort,
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
	public Mono<String> generate(String composedInput,
		List<DialogueMessage> history,
		NpcProfile profile) {
		return Mono.fromCallable(() -> buildMessages(composedInput, history, profile))
			.flatMap(messages -> llmPort.complete(CompletionRequest.of(messages, model)))
			.timeout(timeout);
	}

	List<Message> buildMessages(String composedInput,
		List<DialogueMessage> history,
		NpcProfile profile) {
		List<Message> messages = new ArrayList<>();
		messages.add(Message.system(systemPrompt(profile)));
		for (DialogueMessage message : history) {
			messages.add(message.role() == SpeakerRole.HUMAN
				? Message.user(message.content())
				: Message.assistant(message.content()));
		}
		messages.add(Message.user(composedInput));
		return messages;
	}

	private String systemPrompt(NpcProfile profile) {
		return promptTemplate.load(templateName, Map.of(
			"name", profile.name(),
			"title", profile.title(),
			"personality", profile.personality(),
			"expertise", profile.expertise(),
			"speakingStyle", profile.speakingStyle(),
			"hobbies", profile.hobbies(),
			"location", profile.location(),
			"activity", profile.activity())).trim();
	}
}
