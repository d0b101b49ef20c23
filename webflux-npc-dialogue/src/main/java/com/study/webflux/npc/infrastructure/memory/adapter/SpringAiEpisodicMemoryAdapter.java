package com.study.webflux.npc.infrastructure.memory.adapter;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import com.study.webflux.npc.domain.dialogue.model.NpcId;
import com.study.webflux.npc.domain.memory.model.EpisodicMemory;
import com.study.webflux.npc.domain.memory.port.EpisodicMemoryPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI {@link VectorStore}에 NPC별 장기 기억을 저장하고 검색합니다. 모든 문서는 {@code npcId} 메타데이터로 구분됩니다.
 */
public class SpringAiEpisodicMemoryAdapter implements EpisodicMemoryPort {

	static final String NPC_ID = "npcId";
	static final String RECENT_QUERY = "최근 대화";
	static final int RECENT_SCAN_FACTOR = 5;
	static final int MAX_RECENT_SCAN = 250;

	private final VectorStore vectorStore;

	public SpringAiEpisodicMemoryAdapter(VectorStore vectorStore) {
		this.vectorStore = vectorStore;
	}

	@Override
	public Mono<List<EpisodicMemory>> search(NpcId npcId, String query, int topK) {
		return Mono.fromCallable(() -> {
			SearchRequest request = SearchRequest.builder()
				.query(query)
				.topK(topK)
				.filterExpression(filterFor(npcId))
				.build();
			List<Document> documents = vectorStore.similaritySearch(request);
			return documents == null ? List.<EpisodicMemory>of() : toMemories(documents);
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public Mono<Void> add(NpcId npcId, List<EpisodicMemory> entries) {
		if (entries.isEmpty()) {
			return Mono.empty();
		}
		return Mono.fromRunnable(() -> vectorStore.add(entries.stream()
			.map(entry -> toDocument(npcId, entry))
			.toList()))
			.subscribeOn(Schedulers.boundedElastic())
			.then();
	}

	/**
	 * 근사 조회입니다. 벡터 저장소는 시간순 조회를 지원하지 않으므로 고정 질의로 {@code limit}의 최대
	 * {@value #RECENT_SCAN_FACTOR}배(상한 {@value #MAX_RECENT_SCAN}건)를 검색한 뒤 타임스탬프 역순으로 자릅니다. 후보 범위
	 * 밖의 기억은 더 최신이어도 빠질 수 있습니다.
	 */
	@Override
	public Mono<List<EpisodicMemory>> recent(NpcId npcId, int limit) {
		int scanSize = Math.max(limit, Math.min(MAX_RECENT_SCAN, limit * RECENT_SCAN_FACTOR));
		return search(npcId, RECENT_QUERY, scanSize)
			.map(memories -> memories.stream()
				.sorted(Comparator.comparing(EpisodicMemory::timestamp).reversed())
				.limit(limit)
				.toList());
	}

	private String filterFor(NpcId npcId) {
		return NPC_ID + " == '" + npcId.value() + "'";
	}

	private Document toDocument(NpcId npcId, EpisodicMemory entry) {
		Map<String, Object> metadata = new HashMap<>(entry.metadata());
		metadata.put(NPC_ID, npcId.value());
		return new Document(entry.content(), metadata);
	}

	private List<EpisodicMemory> toMemories(List<Document> documents) {
		return documents.stream()
			.filter(document -> document.getText() != null && !document.getText().isBlank())
			.map(document -> new EpisodicMemory(document.getText(), withoutNpcId(document)))
			.toList();
	}

	private Map<String, Object> withoutNpcId(Document document) {
		Map<String, Object> metadata = new HashMap<>(document.getMetadata());
		metadata.remove(NPC_ID);
		metadata.values().removeIf(value -> value == null);
		return metadata;
	}
}
