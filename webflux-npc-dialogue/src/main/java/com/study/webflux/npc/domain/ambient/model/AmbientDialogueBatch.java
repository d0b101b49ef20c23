package com.study.webflux.npc.domain.ambient.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.study.webflux.npc.domain.dialogue.model.NpcId;

/**
 * 모든 NPC의 배경 대사 한 묶음입니다. 대사 순서는 NPC 등록 순서를 따릅니다.
 */
public record AmbientDialogueBatch(
	Map<NpcId, String> lines,
	AmbientSource source,
	DayPeriod period,
	String scene,
	Instant generatedAt
) {
	public AmbientDialogueBatch {
		if (lines == null) {
			throw new IllegalArgumentException("lines cannot be null");
		}
		if (source == null || period == null || generatedAt == null) {
			throw new IllegalArgumentException("source, period and generatedAt cannot be null");
		}
		lines = Collections.unmodifiableMap(new LinkedHashMap<>(lines));
		scene = scene == null ? "" : scene;
	}
}
