package com.study.webflux.npc.infrastructure.dialogue.adapter.llm;

import java.util.List;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;

import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import com.study.webflux.npc.domain.llm.model.Message;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI {@link ChatModel}로 완성 요청을 보냅니다. 블로킹 호출은 boundedElastic 스케줄러에서 실행합니다.
 */
public class SpringAiLlmAdapter implements LlmPort {

	private final ChatModel chatModel;

	public SpringAiLlmAdapter(ChatModel chatModel) {
		this.chatModel = chatModel;
	}

	@Override
	public Mono<String> complete(CompletionRequest request) {
		Prompt prompt = new Prompt(convertMessages(request.messages()), optionsOf(request));

		return Mono.fromCallable(() -> {
			ChatResponse response = chatModel.call(prompt);
			if (response == null || response.getResult() == null
				|| response.getResult().getOutput() == null) {
				throw new IllegalStateException("Invalid response from LLM");
			}
			String text = response.getResult().getOutput().getText();
			if (text == null) {
				throw new IllegalStateException("Empty response from LLM");
			}
			return text;
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private OpenAiChatOptions optionsOf(CompletionRequest request) {
		OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder();
		if (request.model() != null && !request.model().isBlank()) {
			builder.model(request.model());
		}
		if (request.temperature() != null) {
			builder.temperature(request.temperature());
		}
		return builder.build();
	}

	private List<org.springframework.ai.chat.messages.Message> convertMessages(
		List<Message> messages) {
		return messages.stream().map(this::convertMessage).toList();
	}

	private org.springframework.ai.chat.messages.Message convertMessage(Message message) {
		return switch (message.role()) {
			case SYSTEM -> new SystemMessage(message.content());
			case USER -> new UserMessage(message.content());
			case ASSISTANT -> new AssistantMessage(message.content());
		};
	}
}
