package io.github.drompincen.agentbridge.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        Long conversationId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, Long conversationId, JsonNode payload) {
        return new WsMessage(type, conversationId, payload, Instant.now());
    }

    public static WsMessage tick(long conversationId) {
        return of(WsMessageType.TICK, conversationId, null);
    }

    public static WsMessage error(Long conversationId, JsonNode payload) {
        return of(WsMessageType.ERROR, conversationId, payload);
    }
}
