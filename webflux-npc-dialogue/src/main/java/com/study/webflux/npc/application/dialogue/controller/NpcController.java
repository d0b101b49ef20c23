package com.study.webflux.npc.application.dialogue.controller;

import java.util.List;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.npc.application.ambient.AmbientDialogueService;
import com.study.webflux.npc.application.dialogue.controller.docs.NpcApi;
import com.study.webflux.npc.application.dialogue.dto.AffinityResponse;
import com.study.webflux.npc.application.dialogue.dto.AffinityUpdateRequest;
import com.study.webflux.npc.application.dialogue.dto.AmbientDialogueResponse;
import com.study.webflux.npc.application.dialogue.dto.EpisodicMemoryResponse;
import com.study.webflux.npc.application.dialogue.dto.MemoryClearResponse;
import com.study.webflux.npc.application.dialogue.dto.NpcSummaryResponse;
import com.study.webflux.npc.application.npc.NpcRoster;
import com.study.webflux.npc.application.npc.NpcRoster.NpcEntry;
import com.study.webflux.npc.application.npc.NpcStateService;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
@RequestMapping("/npc")
public class NpcController implements NpcApi {

	private static final int MAX_MEMORY_LIMIT = 50;

	private final NpcRoster npcRoster;
	private final NpcStateService npcStateService;
	private final AmbientDialogueService ambientDialogueService;

	@Override
	@GetMapping
	public Mono<List<NpcSummaryResponse>> npcs() {
		return Mono.fromSupplier(() -> npcRoster.all().stream()
			.map(NpcSummaryResponse::from)
			.toList());
	}

	@Override
	@GetMapping("/affinities")
	public Mono<List<AffinityResponse>> affinities(@RequestParam(required = false) String playerId) {
		PlayerId player = PlayerId.ofNullable(playerId);
		List<NpcId> npcIds = npcRoster.all().stream().map(NpcEntry::npcId).toList();
		return npcStateService.affinitiesOf(npcIds, player)
			.map(snapshots -> snapshots.entrySet().stream()
				.map(entry -> AffinityResponse.of(entry.getKey().value(), player.value(), entry.getValue()))
				.toList());
	}

	@Override
	@GetMapping("/ambient")
	public Mono<AmbientDialogueResponse> ambient(@RequestParam(required = false) String scene) {
		return ambientDialogueService.generate(scene).map(AmbientDialogueResponse::from);
	}

	@Override
	@GetMapping("/{npcId}/affinity")
	public Mono<AffinityResponse> affinity(@PathVariable String npcId,
		@RequestParam(required = false) String playerId) {
		NpcId npc = requireKnown(npcId);
		PlayerId player = PlayerId.ofNullable(playerId);
		return npcStateService.affinityOf(npc, player)
			.map(snapshot -> AffinityResponse.of(npc.value(), player.value(), snapshot));
	}

	@Override
	@PutMapping("/{npcId}/affinity")
	public Mono<AffinityResponse> updateAffinity(@PathVariable String npcId,
		@Valid @RequestBody AffinityUpdateRequest request) {
		NpcId npc = requireKnown(npcId);
		PlayerId player = PlayerId.ofNullable(request.playerId());
		return npcStateService.setAffinity(npc, player, request.affinity())
			.map(snapshot -> AffinityResponse.of(npc.value(), player.value(), snapshot))
			.switchIfEmpty(Mono.error(() -> new ResponseStatusException(
				HttpStatus.SERVICE_UNAVAILABLE,
				"Affinity system is disabled")));
	}

	@Override
	@DeleteMapping("/{npcId}/memory")
	public Mono<MemoryClearResponse> clearMemory(@PathVariable String npcId,
		@RequestParam(required = false) String playerId) {
		NpcId npc = requireKnown(npcId);
		PlayerId player = PlayerId.ofNullable(playerId);
		return npcStateService.clearHistory(npc, player)
			.map(cleared -> new MemoryClearResponse(npc.value(), player.value(), cleared));
	}

	@Override
	@GetMapping("/{npcId}/memories")
	public Mono<List<EpisodicMemoryResponse>> memories(@PathVariable String npcId,
		@RequestParam(defaultValue = "10") int limit) {
		NpcId npc = requireKnown(npcId);
		int bounded = Math.max(1, Math.min(MAX_MEMORY_LIMIT, limit));
		return npcStateService.memoriesOf(npc, bounded)
			.map(memories -> memories.stream().map(EpisodicMemoryResponse::from).toList());
	}

	private NpcId requireKnown(String npcId) {
		NpcId npc = NpcId.of(npcId);
		if (npcRoster.find(npc).isEmpty()) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown npc: " + npcId);
		}
		return npc;
	}
}
