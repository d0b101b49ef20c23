package com.study.webflux.npc.domain.dialogue.port;

import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.dialogue.model.NpcProfile;
import com.study.webflux.npc.domain.dialogue.model.PlayerId;
import com.study.webflux.npc.domain.dialogue.model.TurnResult;
import reactor.core.publisher.Mono;

/**
 * 플레이어 발화 하나를 NPC 응답 하나로 바꾸는 대화 턴 유스케이스입니다.
 */
public interface DialogueTurnUseCase {

	/**
	 * 대화 턴을 실행합니다.
	 *
	 * @param npcId
	 *            대화 상대 NPC
	 * @param playerId
	 *            플레이어 ID
	 * @param utterance
	 *            플레이어 발화
	 * @param profile
	 *            NPC 역할 정보
	 * @return 응답 또는 치명적 오류를 담은 턴 결과 (에러 시그널 없음)
	 */
	Mono<TurnResult> runTurn(NpcId npcId, PlayerId playerId, String utterance, NpcProfile profile);
}
