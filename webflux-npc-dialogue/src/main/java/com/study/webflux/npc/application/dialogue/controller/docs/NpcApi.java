package com.study.webflux.npc.application.dialogue.controller.docs;

import java.util.List;

import com.study.webflux.npc.application.dialogue.dto.AffinityResponse;
import com.study.webflux.npc.application.dialogue.dto.AffinityUpdateRequest;
import com.study.webflux.npc.application.dialogue.dto.AmbientDialogueResponse;
import com.study.webflux.npc.application.dialogue.dto.EpisodicMemoryResponse;
import com.study.webflux.npc.application.dialogue.dto.MemoryClearResponse;
import com.study.webflux.npc.application.dialogue.dto.NpcSummaryResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Tag(
	name = "NPC 관리 API",
	description = "NPC 목록, 호감도, 기억, 배경 대사 조회 및 조정"
)
public interface NpcApi {

	@Operation(summary = "NPC 목록", description = "설정된 NPC와 장기 기억 사용 여부를 반환합니다")
	Mono<List<NpcSummaryResponse>> npcs();

	@Operation(summary = "전체 호감도 조회", description = "등록된 모든 NPC에 대한 플레이어의 호감도를 등록 순서대로 반환합니다")
	Mono<List<AffinityResponse>> affinities(String playerId);

	@Operation(summary = "배경 대사 생성",
		description = "모든 NPC의 배경 대사를 한 번에 생성합니다. 생성에 실패하면 시간대별 기본 대사를 반환합니다")
	Mono<AmbientDialogueResponse> ambient(String scene);

	@Operation(summary = "호감도 조회", description = "호감도 시스템이 꺼져 있으면 기본 관계를 반환합니다")
	@ApiResponse(responseCode = "404", description = "등록되지 않은 NPC")
	Mono<AffinityResponse> affinity(String npcId, String playerId);

	@Operation(summary = "호감도 설정", description = "호감도를 0~100 범위로 직접 설정합니다")
	@ApiResponse(responseCode = "404", description = "등록되지 않은 NPC")
	@ApiResponse(responseCode = "503", description = "호감도 시스템 비활성화")
	Mono<AffinityResponse> updateAffinity(String npcId, @Valid AffinityUpdateRequest request);

	@Operation(summary = "단기 대화 기록 삭제")
	@ApiResponse(responseCode = "404", description = "등록되지 않은 NPC")
	Mono<MemoryClearResponse> clearMemory(String npcId, String playerId);

	@Operation(summary = "장기 기억 조회", description = "장기 기억을 사용하지 않는 NPC는 빈 목록을 반환합니다")
	@ApiResponse(responseCode = "404", description = "등록되지 않은 NPC")
	Mono<List<EpisodicMemoryResponse>> memories(String npcId, int limit);
}
