package com.study.webflux.npc.application.agent;

import com.study.webflux.npc.domain.dialogue.model.RevisionOutcome;

/**
 * 검토자의 원문 판정을 최종 응답으로 해석합니다.
 *
 * <ul>
 * <li>{@code PASS}: 원래 응답 유지</li>
 * <li>{@code REVISED:} 접두어: 접두어를 제거한 나머지로 교체</li>
 * <li>그 밖의 비어 있지 않은 판정: 판정 전체로 교체하고 {@link #UNMARKED_NOTE}를 남김</li>
 * <li>빈 판정: 원래 응답 유지</li>
 * </ul>
 */
public final class ReviewVerdict {

	public static final String APPROVAL_TOKEN = "PASS";
	public static final String REVISION_MARKER = "REVISED:";

	static final String UNMARKED_NOTE = "unmarked verdict used verbatim";

	private ReviewVerdict() {
	}

	public static RevisionOutcome interpret(String verdict, String originalReply) {
		if (verdict == null || verdict.isBlank()) {
			return RevisionOutcome.unchanged(originalReply, "");
		}
		String trimmed = verdict.strip();
		if (APPROVAL_TOKEN.equals(trimmed)) {
			return RevisionOutcome.unchanged(originalReply, trimmed);
		}
		if (trimmed.startsWith(REVISION_MARKER)) {
			String revised = trimmed.substring(REVISION_MARKER.length()).strip();
			if (revised.isEmpty()) {
				return RevisionOutcome.unchanged(originalReply, trimmed);
			}
			return RevisionOutcome.revised(revised, trimmed, "");
		}
		return RevisionOutcome.revised(trimmed, trimmed, UNMARKED_NOTE);
	}
}
