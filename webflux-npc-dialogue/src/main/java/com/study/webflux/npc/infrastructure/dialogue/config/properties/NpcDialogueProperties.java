package com.study.webflux.npc.infrastructure.dialogue.config.properties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "npc.dialogue")
public class NpcDialogueProperties {

	private Memory memory = new Memory();
	private Revision revision = new Revision();
	private Pipeline pipeline = new Pipeline();
	private Llm llm = new Llm();
	private Affinity affinity = new Affinity();
	private Context context = new Context();
	private Templates templates = new Templates();
	private Cors cors = new Cors();
	private Ambient ambient = new Ambient();
	private Map<String, Npc> npcs = new LinkedHashMap<>();

	@Getter
	@Setter
	public static class Memory {
		/** 생성 입력에 포함할 최근 대화 기록 수 */
		private int maxHistory = 10;
		private int episodicTopK = 3;
		private Duration ttl = Duration.ofHours(24);
		/** 장기 기억 저장소를 사용하는 NPC ID 목록 */
		private List<String> episodicNpcs = new ArrayList<>();
	}

	@Getter
	@Setter
	public static class Revision {
		private boolean enabled = true;
	}

	@Getter
	@Setter
	public static class Pipeline {
		/** false면 기억 조회와 호감도 조회를 순차로 실행합니다. */
		private boolean parallelRetrieval = true;
	}

	@Getter
	@Setter
	public static class Llm {
		private String model = "gpt-4o-mini";
		private String reviewModel;
		private Duration timeout = Duration.ofSeconds(30);
	}

	@Getter
	@Setter
	public static class Affinity {
		/** false면 호감도 협력자 없이 기본 관계로만 대화합니다. */
		private boolean enabled = true;
		/** 한 번의 대화로 변할 수 있는 최대 호감도 */
		private double maxDelta = 10.0;
	}

	@Getter
	@Setter
	public static class Context {
		private Duration idleTimeout = Duration.ofMinutes(5);
		private Duration cleanupInterval = Duration.ofMinutes(1);
	}

	@Getter
	@Setter
	public static class Templates {
		private String system = "npc-system";
		private String review = "reply-review";
		private String affinity = "affinity-analysis";
		private String ambient = "ambient-batch";
	}

	@Getter
	@Setter
	public static class Ambient {
		/** 기본 대사의 시간대를 정하는 시간대 */
		private String zone = "Asia/Seoul";
		/** 시간대(morning, noon, afternoon, evening)별 NPC ID와 기본 대사 */
		private Map<String, Map<String, String>> presets = new LinkedHashMap<>();
	}

	@Getter
	@Setter
	public static class Cors {
		/** 비어 있으면 CORS를 허용하지 않습니다. */
		private List<String> allowedOrigins = new ArrayList<>();
	}

	@Getter
	@Setter
	public static class Npc {
		private String name;
		private String title;
		private String personality;
		private String expertise;
		private String speakingStyle;
		private String hobbies;
		private String location;
		private String activity;
	}
}
