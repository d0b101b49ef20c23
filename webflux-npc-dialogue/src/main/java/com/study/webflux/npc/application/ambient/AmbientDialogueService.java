package com.study.webflux.npc.application.ambient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.npc.application.npc.NpcRoster;
import com.study.webflux.npc.domain.agent.model.CollaboratorBinding;
import com.study.webflux.npc.domain.ambient.model.AmbientDialogueBatch;
import com.study.webflux.npc.domain.ambient.model.AmbientScene;
import com.study.webflux.npc.domain.ambient.model.AmbientSource;
import com.study.webflux.npc.domain.ambient.model.DayPeriod;
import com.study.webflux.npc.domain.ambient.port.AmbientLineGenerator;
import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import reactor.core.publisher.Mono;

/**
 * 플레이어와 대화하지 않는 동안 NPC들이 보여줄 배경 대사를 만듭니다.
 *
 * <p>
 * 생성기가 있으면 모든 NPC의 대사를 한 번에 생성하고, 생성기가 없거나 호출이 실패하거나 응답을 해석할 수 없으면 현재 시간대의 기본 대사를
 * 반환합니다. 기본 대사가 설정되지 않은 NPC는 현재 하는 일을, 그것도 없으면 {@link #IDLE_LINE}을 사용합니다.
 */
@Slf4j
public class AmbientDialogueService {

	static final String IDLE_LINE = "...";

	private final CollaboratorBinding<AmbientLineGenerator> generator;
	private final NpcRoster npcRoster;
	private final Map<DayPeriod, Map<NpcId, String>> presets;
	private final Clock clock;
	private final ZoneId zone;

	public AmbientDialogueService(CollaboratorBinding<AmbientLineGenerator> generator,
		NpcRoster npcRoster,
		Map<DayPeriod, Map<NpcId, String>> presets,
		Clock clock,
		ZoneId zone) {
		this.generator = generator;
		this.npcRoster = npcRoster;
		this.presets = new EnumMap<>(DayPeriod.class);
		presets.forEach((period, lines) -> this.presets.put(period, Map.copyOf(lines)));
		this.clock = clock;
		this.zone = zone;
	}

	/**
	 * @param scene
	 *            장면 설명, 비어 있으면 현재 시각으로 정합니다
	 */
	public Mono<AmbientDialogueBatch> generate(String scene) {
		return Mono.defer(() -> {
			Instant now = clock.instant();
			int hour = now.atZone(zone).getHour();
			DayPeriod period = DayPeriod.ofHour(hour);
			String resolvedScene = scene == null || scene.isBlank() ? AmbientScene.at(hour) : scene.strip();
			Map<NpcId, NpcProfile> npcs = npcRoster.profiles();
			Mono<AmbientDialogueBatch> preset = Mono.fromSupplier(() -> new AmbientDialogueBatch(
				presetLines(period, npcs),
				AmbientSource.PRESET,
				period,
				resolvedScene,
				now));
			if (npcs.isEmpty()) {
				return preset;
			}
			return generator.fold(
				lineGenerator -> lineGenerator.generate(resolvedScene, npcs)
					.map(lines -> new AmbientDialogueBatch(lines,
						AmbientSource.GENERATED,
						period,
						resolvedScene,
						now))
					.doOnNext(batch -> log.debug("배경 대사 일괄 생성: npcs={}", batch.lines().size()))
					.onErrorResume(error -> {
						log.warn("배경 대사 일괄 생성 실패, 기본 대사를 사용합니다: {}", error.toString());
						return Mono.empty();
					})
					.switchIfEmpty(preset),
				() -> preset);
		});
	}

	Map<NpcId, String> presetLines(DayPeriod period, Map<NpcId, NpcProfile> npcs) {
		Map<NpcId, String> configured = presets.getOrDefault(period, Map.of());
		Map<NpcId, String> lines = new LinkedHashMap<>();
		npcs.forEach((npcId, profile) -> {
			String line = configured.get(npcId);
			if (line == null || line.isBlank()) {
				line = profile.activity().isBlank() ? IDLE_LINE : profile.activity();
			}
			lines.put(npcId, line);
		});
		return lines;
	}
}
