package com.study.webflux.npc.domain.llm.port;

import com.study.webflux.npc.domain.llm.model.CompletionRequest;
import reactor.core.publisher.Mono;

public interface LlmPort {

	Mono<String> complete(CompletionRequest request);
}
