package com.study.webflux.npc.infrastructure.common.template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * classpath의 {@code templates/} 아래 프롬프트 템플릿을 읽어 {@code {{변수}}}를 치환합니다.
 */
@Component
public class FileBasedPromptTemplate {

	private static final List<String> TEMPLATE_EXTENSIONS = List.of(".md", ".txt");
	private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> cache = new ConcurrentHashMap<>();

	public String load(String templateName) {
		return load(templateName, Map.of());
	}

	public String load(String templateName, Map<String, String> variables) {
		String template = cache.computeIfAbsent(templateName, this::read);
		if (variables.isEmpty()) {
			return template;
		}
		// 치환된 값은 다시 검사하지 않습니다. 등록되지 않은 변수는 그대로 둡니다.
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder result = new StringBuilder(template.length());
		while (matcher.find()) {
			String key = matcher.group(1);
			String replacement = variables.containsKey(key)
				? nullToEmpty(variables.get(key))
				: matcher.group();
			matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}

	private String read(String templateName) {
		try {
			ClassPathResource resource = resolveResource(templateName);
			return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to load template: " + templateName, e);
		}
	}

	private ClassPathResource resolveResource(String templateName) throws IOException {
		for (String ext : TEMPLATE_EXTENSIONS) {
			ClassPathResource resource = new ClassPathResource("templates/" + templateName + ext);
			if (resource.exists()) {
				return resource;
			}
		}
		throw new IOException("Template not found for name: " + templateName);
	}
}
