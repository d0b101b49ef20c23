package com.study.webflux.npc.domain.dialogue.port;

import java.util.List;

import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.memory.model.DialogueMessage;
import reactor.core.publisher.Mono;

/** NPC 응답을 생성하는 외부 협력자입니다. */
public interface ReplyGenerationPort {

	/**
	 * @param composedInput
	 *            관계, 기억, 현재 대화 블록으로 구성된 입력
	 * @param history
	 *            최근 대화 기록 (오래된 순)
	 * @param profile
	 *            NPC 역할 정보
	 * @return 생성된 응답
	 */
	Mono<String> generate(String composedInput, List<DialogueMessage> history, NpcProfile profile);
}
