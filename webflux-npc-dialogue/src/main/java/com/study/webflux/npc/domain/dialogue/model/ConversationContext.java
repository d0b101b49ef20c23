package com.study.webflux.npc.domain.dialogue.model;

import java.time.Instant;
import java.util.Optional;

import com.study.webflux.npc.domain.affinity.model.AffinitySnapshot;
import com.study.webflux.npc.domain.memory.model.MemorySnapshot;

/**
 * 한 턴 동안 단계 사이에 전달되는 작업 상태입니다.
 *
 * <p>
 * 입력(NPC, 플레이어, 발화)은 생성 시 고정되고, 각 단계의 출력 필드는 소유 단계가 정확히 한 번만 기록합니다. 두 번째 기록은
 * {@link IllegalStateException}을 던집니다. 하나의 컨텍스트는 하나의 턴만 소유합니다.
 */
public final class ConversationContext {

	private static final int PREVIEW_LENGTH = 50;

	private final ContextKey key;
	private final String utterance;
	private final NpcProfile profile;

	// 턴 실행 중에도 컨텍스트 조회 요청이 다른 스레드에서 읽습니다.
	private volatile MemorySnapshot memory;
	private volatile AffinitySnapshot affinity;
	private volatile GeneratedReply dialogue;
	private volatile RevisionOutcome revision;

	private ConversationContext(ContextKey key, String utterance, NpcProfile profile) {
		if (key == null) {
			throw new IllegalArgumentException("key cannot be null");
		}
		if (utterance == null || utterance.isBlank()) {
			throw new IllegalArgumentException("utterance cannot be null or blank");
		}
		if (profile == null) {
			throw new IllegalArgumentException("profile cannot be null");
		}
		this.key = key;
		this.utterance = utterance;
		this.profile = profile;
	}

	public static ConversationContext start(ContextKey key, String utterance, NpcProfile profile) {
		return new ConversationContext(key, utterance, profile);
	}

	public ContextKey key() {
		return key;
	}

	public String id() {
		return key.asString();
	}

	public NpcId npcId() {
		return key.npcId();
	}

	public PlayerId playerId() {
		return key.playerId();
	}

	public Instant createdAt() {
		return key.createdAt();
	}

	public String utterance() {
		return utterance;
	}

	public NpcProfile profile() {
		return profile;
	}

	public Optional<MemorySnapshot> memory() {
		return Optional.ofNullable(memory);
	}

	public Optional<AffinitySnapshot> affinity() {
		return Optional.ofNullable(affinity);
	}

	public Optional<GeneratedReply> dialogue() {
		return Optional.ofNullable(dialogue);
	}

	public Optional<RevisionOutcome> revision() {
		return Optional.ofNullable(revision);
	}

	public void applyMemory(MemorySnapshot snapshot) {
		requireUnset(memory, "memory");
		this.memory = requireValue(snapshot, "memory");
	}

	public void applyAffinity(AffinitySnapshot snapshot) {
		requireUnset(affinity, "affinity");
		this.affinity = requireValue(snapshot, "affinity");
	}

	public void applyDialogue(GeneratedReply reply) {
		requireUnset(dialogue, "dialogue");
		this.dialogue = requireValue(reply, "dialogue");
	}

	public void applyRevision(RevisionOutcome outcome) {
		requireUnset(revision, "revision");
		if (dialogue == null) {
			throw new IllegalStateException("revision requires a generated reply");
		}
		this.revision = requireValue(outcome, "revision");
	}

	/**
	 * 검토 결과가 있으면 검토된 응답을, 없으면 생성된 응답을 반환합니다.
	 */
	public String finalReply() {
		if (revision != null) {
			return revision.finalReply();
		}
		if (dialogue != null) {
			return dialogue.reply();
		}
		throw new IllegalStateException("no reply has been generated for context " + id());
	}

	public ContextSummary summary() {
		String preview = utterance.length() > PREVIEW_LENGTH
			? utterance.substring(0, PREVIEW_LENGTH)
			: utterance;
		return new ContextSummary(id(),
			npcId().value(),
			playerId().value(),
			preview,
			memory != null,
			affinity != null,
			dialogue != null,
			revision != null,
			createdAt());
	}

	private static void requireUnset(Object current, String field) {
		if (current != null) {
			throw new IllegalStateException(field + " has already been written");
		}
	}

	private static <T> T requireValue(T value, String field) {
		if (value == null) {
			throw new IllegalArgumentException(field + " cannot be null");
		}
		return value;
	}
}
