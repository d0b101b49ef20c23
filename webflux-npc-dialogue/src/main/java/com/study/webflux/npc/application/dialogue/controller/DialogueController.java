package com.study.webflux.npc.application.dialogue.controller;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.npc.application.dialogue.context.ConversationContextRegistry;
import com.study.webflux.npc.application.dialogue.controller.docs.DialogueApi;
import com.study.webflux.npc.application.dialogue.dto.ContextSummaryResponse;
import com.study.webflux.npc.application.dialogue.dto.NpcDialogueRequest;
import com.study.webflux.npc.application.dialogue.dto.NpcDialogueResponse;
import com.study.webflux.npc.application.npc.NpcRoster;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import com.study.webflux.npc.domain.dialogue.port.DialogueTurnUseCase;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
@RequestMapping("/npc/dialogue")
public class DialogueController implements DialogueApi {

	private final DialogueTurnUseCase dialogueTurnUseCase;
	private final NpcRoster npcRoster;
	private final ConversationContextRegistry contextRegistry;

	@Override
	@PostMapping
	public Mono<ResponseEntity<NpcDialogueResponse>> chat(
		@Valid @RequestBody NpcDialogueRequest request) {
		NpcId npcId = NpcId.of(request.npcId());
		return Mono.justOrEmpty(npcRoster.find(npcId))
			.switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
				"Unknown npc: " + npcId.value())))
			.flatMap(profile -> dialogueTurnUseCase.runTurn(npcId,
				PlayerId.ofNullable(request.playerId()),
				request.message(),
				profile))
			.map(result -> ResponseEntity
				.status(result.success() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY)
				.body(NpcDialogueResponse.from(result)));
	}

	@Override
	@GetMapping("/contexts/{contextId}")
	public Mono<ContextSummaryResponse> context(@PathVariable String contextId) {
		return Mono.justOrEmpty(contextRegistry.find(contextId))
			.map(context -> ContextSummaryResponse.from(context.summary()))
			.switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
				"Unknown or expired context: " + contextId)));
	}
}
