package com.study.webflux.npc.application.dialogue.controller.docs;

import org.springframework.http.ResponseEntity;

import com.study.webflux.npc.application.dialogue.dto.ContextSummaryResponse;
import com.study.webflux.npc.application.dialogue.dto.NpcDialogueRequest;
import com.study.webflux.npc.application.dialogue.dto.NpcDialogueResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Tag(
	name = "NPC 대화 API",
	description = "기억, 호감도, 응답 검토를 포함한 NPC 대화 턴"
)
public interface DialogueApi {

	@Operation(
		summary = "NPC와 대화",
		description = "플레이어 발화 하나에 대한 NPC 응답을 생성합니다. 기억/호감도 조회 실패는 기본값으로 대체됩니다"
	)
	@ApiResponse(responseCode = "200", description = "응답 생성 성공")
	@ApiResponse(responseCode = "404", description = "등록되지 않은 NPC")
	@ApiResponse(responseCode = "502", description = "응답 생성 실패로 턴 중단")
	Mono<ResponseEntity<NpcDialogueResponse>> chat(
		@Valid NpcDialogueRequest request
	);

	@Operation(
		summary = "대화 컨텍스트 조회",
		description = "만료되지 않은 대화 컨텍스트의 요약을 반환합니다"
	)
	@ApiResponse(responseCode = "200", description = "컨텍스트 요약")
	@ApiResponse(responseCode = "404", description = "없거나 만료된 컨텍스트")
	Mono<ContextSummaryResponse> context(
		String contextId
	);
}
