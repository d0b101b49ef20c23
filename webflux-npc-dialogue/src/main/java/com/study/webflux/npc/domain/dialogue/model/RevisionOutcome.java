package com.study.webflux.npc.domain.dialogue.model;

/**
 * 검토 단계의 출력입니다.
 *
 * @param finalReply
 *            사용자에게 전달할 최종 응답
 * @param revised
 *            검토자가 응답을 교체했는지 여부
 * @param verdict
 *            검토자의 원문 판정 (없으면 빈 문자열)
 * @param note
 *            진단 메모 (없으면 빈 문자열)
 */
public record RevisionOutcome(
	String finalReply,
	boolean revised,
	String verdict,
	String note
) {
	public RevisionOutcome {
		if (finalReply == null || finalReply.isBlank()) {
			throw new IllegalArgumentException("finalReply cannot be null or blank");
		}
		verdict = verdict == null ? "" : verdict;
		note = note == null ? "" : note;
	}

	public static RevisionOutcome unchanged(String reply, String verdict) {
		return new RevisionOutcome(reply, false, verdict, "");
	}

	public static RevisionOutcome revised(String revisedReply, String verdict, String note) {
		return new RevisionOutcome(revisedReply, true, verdict, note);
	}

	public static RevisionOutcome failed(String originalReply, String note) {
		return new RevisionOutcome(originalReply, false, "", note);
	}

	public boolean hasNote() {
		return !note.isBlank();
	}

	/** 검토 중 오류로 원래 응답을 유지한 경우입니다. */
	public boolean reviewFailed() {
		return !revised && hasNote();
	}
}
