package com.study.webflux.npc.application.npc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryDirectory;

/**
 * 설정된 NPC 목록과 각 NPC의 역할 정보를 제공합니다.
 */
@Slf4j
public class NpcRoster {

	private final Map<NpcId, NpcProfile> profiles;
	private final EpisodicMemoryDirectory episodicMemories;

	public NpcRoster(Map<NpcId, NpcProfile> profiles, EpisodicMemoryDirectory episodicMemories) {
		this.profiles = new LinkedHashMap<>(profiles);
		this.episodicMemories = episodicMemories;
		if (this.profiles.isEmpty()) {
			log.warn("설정된 NPC가 없습니다. npc.dialogue.npcs 설정을 확인하세요");
		}
	}

	public Optional<NpcProfile> find(NpcId npcId) {
		return Optional.ofNullable(profiles.get(npcId));
	}

	public List<NpcEntry> all() {
		return profiles.entrySet().stream()
			.map(entry -> new NpcEntry(entry.getKey(),
				entry.getValue(),
				episodicMemories.storeFor(entry.getKey()).isConfigured()))
			.toList();
	}

	/** 등록 순서를 유지한 전체 프로필입니다. */
	public Map<NpcId, NpcProfile> profiles() {
		return new LinkedHashMap<>(profiles);
	}

	public Map<NpcId, String> names() {
		Map<NpcId, String> names = new LinkedHashMap<>();
		profiles.forEach((npcId, profile) -> names.put(npcId, profile.name()));
		return names;
	}

	public record NpcEntry(NpcId npcId, NpcProfile profile, boolean episodicMemoryEnabled) {
	}
}
