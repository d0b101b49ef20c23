package com.study.webflux.npc.application.dialogue.dto;

import com.study.webflux.npc.application.npc.NpcRoster.NpcEntry;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "NPC 정보")
public record NpcSummaryResponse(
	@Schema(description = "NPC ID", example = "blacksmith") String npcId,
	@Schema(description = "이름", example = "브론") String name,
	@Schema(description = "직업", example = "대장장이") String title,
	@Schema(description = "위치", example = "마을 대장간") String location,
	@Schema(description = "현재 하는 일", example = "검을 담금질하는 중") String activity,
	@Schema(description = "장기 기억 사용 여부") boolean episodicMemoryEnabled
) {
	public static NpcSummaryResponse from(NpcEntry entry) {
		return new NpcSummaryResponse(entry.npcId().value(),
			entry.profile().name(),
			entry.profile().title(),
			entry.profile().location(),
			entry.profile().activity(),
			entry.episodicMemoryEnabled());
	}
}
