package com.study.webflux.npc.application.dialogue.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 잘못된 식별자나 값으로 도메인 객체 생성이 실패하면 400 JSON 응답으로 변환합니다.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = {DialogueController.class, NpcController.class})
public class NpcApiExceptionAdvice {

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<Map<String, Object>> handleInvalidArgument(IllegalArgumentException ex) {
		log.debug("잘못된 요청: {}", ex.getMessage());
		HttpStatus status = HttpStatus.BAD_REQUEST;
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("timestamp", Instant.now().toString());
		body.put("status", status.value());
		body.put("error", status.getReasonPhrase());
		body.put("message", ex.getMessage());
		return ResponseEntity.status(status).body(body);
	}
}
