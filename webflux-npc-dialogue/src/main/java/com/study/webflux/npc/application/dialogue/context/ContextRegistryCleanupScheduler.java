package com.study.webflux.npc.application.dialogue.context;

import lombok.RequiredArgsConstructor;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ContextRegistryCleanupScheduler {

	private final ConversationContextRegistry registry;

	@Scheduled(fixedDelayString = "${npc.dialogue.context.cleanup-interval:PT1M}")
	public void evictIdleContexts() {
		registry.evictIdle();
	}
}
