package com.study.webflux.npc.domain.agent.port;

import com.study.webflux.npc.domain.agent.model.AgentResult;
import com.study.webflux.npc.domain.agent.model.DialogueStage;
import com.study.webflux.npc.domain.dialogue.model.ConversationContext;
import reactor.core.publisher.Mono;

/**
 * 파이프라인의 한 단계를 수행하는 작업 단위입니다.
 *
 * <p>
 * 구현체는 내부 오류를 에러 시그널로 내보내지 않고 실패한 {@link AgentResult}로 변환해야 합니다.
 */
public interface DialogueAgent<T> {

	DialogueStage stage();

	/**
	 * 컨텍스트를 읽어 단계를 실행합니다.
	 *
	 * @param context
	 *            현재 턴의 컨텍스트
	 * @return 단계 실행 결과 (에러 시그널 없음)
	 */
	Mono<AgentResult<T>> execute(ConversationContext context);
}
