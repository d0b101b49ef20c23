package com.study.webflux.npc.domain.dialogue.port;

import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import reactor.core.publisher.Mono;

/** 생성된 응답이 역할과 관계에 맞는지 검토하는 외부 협력자입니다. */
public interface ReplyReviewPort {

	/**
	 * 검토자의 원문 판정을 반환합니다. 승인이면 {@code PASS}, 교체면 {@code REVISED: ...} 형식입니다.
	 */
	Mono<String> review(String reply,
		String utterance,
		NpcProfile profile,
		String affinityLevel,
		String affinityStyle);
}
