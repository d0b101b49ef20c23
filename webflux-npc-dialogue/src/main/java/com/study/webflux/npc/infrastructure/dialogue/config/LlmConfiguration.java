package com.study.webflux.npc.infrastructure.dialogue.config;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.dialogue.port.ReplyGenerationPort;
import com.study.webflux.npc.domain.dialogue.port.ReplyReviewPort;
import com.study.webflux.npc.domain.llm.port.LlmPort;
import com.study.webflux.npc.infrastructure.common.template.FileBasedPromptTemplate;
import com.study.webflux.npc.infrastructure.dialogue.adapter.llm.LlmReplyGenerationAdapter;
import com.study.webflux.npc.infrastructure.dialogue.adapter.llm.LlmReplyReviewAdapter;
import com.study.webflux.npc.infrastructure.dialogue.adapter.llm.SpringAiLlmAdapter;
import com.study.webflux.npc.infrastructure.dialogue.config.properties.NpcDialogueProperties;

/**
 * 채팅 모델이 있으면 생성/검토 협력자를 구성하고, 없으면 미설정 상태로 둡니다.
 */
@Slf4j
@Configuration
public class LlmConfiguration {

	@Bean
	public CollaboratorBinding<LlmPort> llmBinding(ObjectProvider<ChatModel> chatModel) {
		ChatModel model = chatModel.getIfAvailable();
		if (model == null) {
			log.warn("ChatModel이 없어 시뮬레이션 모드로 동작합니다 (응답 생성, 검토, 호감도 분석 비활성화)");
			return CollaboratorBinding.unconfigured();
		}
		return CollaboratorBinding.configured(new SpringAiLlmAdapter(model));
	}

	@Bean
	public CollaboratorBinding<ReplyGenerationPort> replyGenerationBinding(
		CollaboratorBinding<LlmPort> llmBinding,
		FileBasedPromptTemplate promptTemplate,
		NpcDialogueProperties properties) {
		NpcDialogueProperties.Llm llm = properties.getLlm();
		return llmBinding.fold(
			llmPort -> CollaboratorBinding.configured(new LlmReplyGenerationAdapter(llmPort,
				promptTemplate,
				properties.getTemplates().getSystem(),
				llm.getModel(),
				llm.getTimeout())),
			CollaboratorBinding::unconfigured);
	}

	@Bean
	public CollaboratorBinding<ReplyReviewPort> replyReviewBinding(
		CollaboratorBinding<LlmPort> llmBinding,
		FileBasedPromptTemplate promptTemplate,
		NpcDialogueProperties properties) {
		NpcDialogueProperties.Llm llm = properties.getLlm();
		String reviewModel = llm.getReviewModel() == null || llm.getReviewModel().isBlank()
			? llm.getModel()
			: llm.getReviewModel();
		return llmBinding.fold(
			llmPort -> CollaboratorBinding.configured(new LlmReplyReviewAdapter(llmPort,
				promptTemplate,
				properties.getTemplates().getReview(),
				reviewModel,
				llm.getTimeout())),
			CollaboratorBinding::unconfigured);
	}
}
