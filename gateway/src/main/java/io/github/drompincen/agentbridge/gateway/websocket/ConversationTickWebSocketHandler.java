package io.github.drompincen.agentbridge.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.protocol.ws.WsMessage;
import io.github.drompincen.agentbridge.protocol.ws.WsMessageType;
import io.github.drompincen.agentbridge.runtime.lifecycle.ConversationEventSource;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes a content-free {@code TICK} to every socket subscribed to a conversation whenever that
 * conversation logs an event. Clients re-read state themselves.
 */
@Component
public class ConversationTickWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ConversationTickWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final ConversationEventSource eventSource;
    private final Map<Long, Set<WebSocketSession>> subscriptions = new ConcurrentHashMap<>();
    private volatile String subscriptionId;

    public ConversationTickWebSocketHandler(ObjectMapper objectMapper, ConversationEventSource eventSource) {
        this.objectMapper = objectMapper;
        this.eventSource = eventSource;
    }

    @PostConstruct
    public void init() {
        subscriptionId = eventSource.subscribeAll(this::onEvent);
    }

    @PreDestroy
    public void destroy() {
        String id = subscriptionId;
        if (id != null) {
            eventSource.unsubscribe(id);
            subscriptionId = null;
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        subscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            send(session, WsMessage.error(null, objectMapper.valueToTree(Map.of("message", "malformed JSON"))));
            return;
        }
        String type = node.path("type").asText();
        JsonNode idNode = node.path("conversationId");
        if (!idNode.canConvertToLong()) {
            send(session, WsMessage.error(null, objectMapper.valueToTree(Map.of("message", "conversationId required"))));
            return;
        }
        long conversationId = idNode.asLong();

        if (WsMessageType.SUBSCRIBE_CONVERSATION.name().equals(type)) {
            subscriptions.computeIfAbsent(conversationId, k -> new CopyOnWriteArraySet<>()).add(session);
            send(session, WsMessage.of(WsMessageType.SUBSCRIBED, conversationId, null));
        } else if (WsMessageType.UNSUBSCRIBE.name().equals(type)) {
            Set<WebSocketSession> set = subscriptions.get(conversationId);
            if (set != null) set.remove(session);
            send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, conversationId, null));
        } else {
            send(session, WsMessage.error(conversationId,
                    objectMapper.valueToTree(Map.of("message", "unsupported type " + type))));
        }
    }

    void onEvent(ConversationEvent event) {
        Set<WebSocketSession> subscribers = subscriptions.get(event.conversation());
        if (subscribers == null || subscribers.isEmpty()) return;
        WsMessage tick = WsMessage.tick(event.conversation());
        for (WebSocketSession ws : subscribers) {
            if (!ws.isOpen()) {
                subscribers.remove(ws);
                continue;
            }
            try {
                send(ws, tick);
            } catch (IOException e) {
                log.warn("Dropping tick for conversation {} on socket {}: {}",
                        event.conversation(), ws.getId(), e.getMessage());
            }
        }
    }

    int subscriberCount(long conversationId) {
        Set<WebSocketSession> set = subscriptions.get(conversationId);
        return set == null ? 0 : set.size();
    }

    private void send(WebSocketSession session, WsMessage message) throws IOException {
        TextMessage text = new TextMessage(objectMapper.writeValueAsString(message));
        synchronized (session) {
            session.sendMessage(text);
        }
    }
}
