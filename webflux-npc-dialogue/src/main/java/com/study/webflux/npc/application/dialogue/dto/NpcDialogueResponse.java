package com.study.webflux.npc.application.dialogue.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import com.study.webflux.npc.domain.dialogue.model.TurnResult;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "NPC 대화 결과")
public record NpcDialogueResponse(
	@Schema(description = "턴 성공 여부", example = "true")
	boolean success,

	@Schema(description = "NPC 응답", example = "어서 오게. 어떤 검을 원하나?")
	String reply,

	@Schema(description = "이번 턴 시작 시점의 호감도", example = "50.0")
	double affinity,

	@Schema(description = "이번 대화로 호감도가 바뀌었는지 여부", example = "false")
	boolean affinityChanged,

	@Schema(description = "단계별 성공 여부 (검토 단계가 비활성화되면 생략)")
	Map<String, Boolean> stageSuccess,

	@Schema(description = "처리 시간(ms)", example = "1240")
	long elapsedMillis,

	@Schema(description = "턴 실패 시 오류 메시지", example = "")
	String error,

	@Schema(description = "대화 컨텍스트 ID", example = "blacksmith_p1_1734782400000")
	String contextId
) {
	public static NpcDialogueResponse from(TurnResult result) {
		Map<String, Boolean> stages = new LinkedHashMap<>();
		result.stageSuccess().forEach((stage, ok) -> stages.put(stage.agentName(), ok));
		return new NpcDialogueResponse(result.success(),
			result.reply(),
			result.affinityScore(),
			result.affinityChanged(),
			stages,
			result.elapsed().toMillis(),
			result.error(),
			result.contextId());
	}
}
