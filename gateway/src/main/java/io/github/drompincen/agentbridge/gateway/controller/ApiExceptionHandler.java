package io.github.drompincen.agentbridge.gateway.controller;

import io.github.drompincen.agentbridge.runtime.lifecycle.LifecycleException;
import io.github.drompincen.agentbridge.runtime.transport.ConversationEndedException;
import io.github.drompincen.agentbridge.runtime.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConversationEndedException.class)
    public ResponseEntity<Map<String, Object>> conversationEnded(ConversationEndedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", "conversation_ended",
                "taskId", String.valueOf(e.getTaskId()),
                "state", e.getState().wireValue()));
    }

    @ExceptionHandler(LifecycleException.class)
    public ResponseEntity<Map<String, Object>> lifecycle(LifecycleException e) {
        log.error("Lifecycle operation failed", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "lifecycle_failure", "message", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<Map<String, Object>> transport(TransportException e) {
        log.warn("Transport failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "transport_failure", "message", String.valueOf(e.getMessage())));
    }
}
