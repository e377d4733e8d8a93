package io.github.drompincen.agentbridge.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.runtime.lifecycle.ConversationEventListener;
import io.github.drompincen.agentbridge.runtime.lifecycle.ConversationEventSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConversationTickWebSocketHandlerTest {

    @Mock private ConversationEventSource eventSource;
    @Mock private WebSocketSession wsSession;
    @Mock private WebSocketSession wsSession2;

    private ObjectMapper objectMapper;
    private ConversationTickWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        handler = new ConversationTickWebSocketHandler(objectMapper, eventSource);
        when(wsSession.isOpen()).thenReturn(true);
        when(wsSession2.isOpen()).thenReturn(true);
        when(eventSource.subscribeAll(any())).thenReturn("sub-1");
    }

    private void subscribe(WebSocketSession session, long conversationId) throws Exception {
        handler.handleTextMessage(session, new TextMessage(
                "{\"type\":\"SUBSCRIBE_CONVERSATION\",\"conversationId\":" + conversationId + "}"));
    }

    private List<JsonNode> sent(WebSocketSession session, int times) throws IOException {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(times)).sendMessage(captor.capture());
        return captor.getAllValues().stream().map(m -> {
            try {
                return objectMapper.readTree(m.getPayload());
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }).toList();
    }

    @Test
    void subscribeSendsAck() throws Exception {
        subscribe(wsSession, 42L);

        JsonNode ack = sent(wsSession, 1).get(0);
        assertThat(ack.path("type").asText()).isEqualTo("SUBSCRIBED");
        assertThat(ack.path("conversationId").asLong()).isEqualTo(42L);
        assertThat(handler.subscriberCount(42L)).isEqualTo(1);
    }

    @Test
    void eventForSubscribedConversationPushesTick() throws Exception {
        subscribe(wsSession, 42L);
        subscribe(wsSession2, 7L);

        handler.onEvent(ConversationEvent.message(42L, 3, "a", Finality.TURN));

        JsonNode tick = sent(wsSession, 2).get(1);
        assertThat(tick.path("type").asText()).isEqualTo("TICK");
        assertThat(tick.path("conversationId").asLong()).isEqualTo(42L);
        assertThat(tick.path("payload").isNull() || tick.path("payload").isMissingNode()).isTrue();
        sent(wsSession2, 1);
    }

    @Test
    void initSubscribesToFeedAndDestroyUnsubscribes() {
        handler.init();
        ArgumentCaptor<ConversationEventListener> captor = ArgumentCaptor.forClass(ConversationEventListener.class);
        verify(eventSource).subscribeAll(captor.capture());

        handler.destroy();
        handler.destroy();

        verify(eventSource, times(1)).unsubscribe("sub-1");
    }

    @Test
    void unsubscribeStopsTicks() throws Exception {
        subscribe(wsSession, 42L);
        handler.handleTextMessage(wsSession,
                new TextMessage("{\"type\":\"UNSUBSCRIBE\",\"conversationId\":42}"));

        handler.onEvent(ConversationEvent.message(42L, 4, "a", Finality.NONE));

        List<JsonNode> messages = sent(wsSession, 2);
        assertThat(messages.get(1).path("type").asText()).isEqualTo("UNSUBSCRIBED");
    }

    @Test
    void closedConnectionIsForgotten() throws Exception {
        subscribe(wsSession, 42L);

        handler.afterConnectionClosed(wsSession, CloseStatus.NORMAL);

        assertThat(handler.subscriberCount(42L)).isZero();
    }

    @Test
    void failingSocketDoesNotBlockOthers() throws Exception {
        subscribe(wsSession, 42L);
        subscribe(wsSession2, 42L);
        doThrow(new IOException("broken pipe")).when(wsSession).sendMessage(any());

        handler.onEvent(ConversationEvent.message(42L, 5, "a", Finality.NONE));

        sent(wsSession2, 2);
    }

    @Test
    void missingConversationIdIsAnError() throws Exception {
        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"SUBSCRIBE_CONVERSATION\"}"));

        assertThat(sent(wsSession, 1).get(0).path("type").asText()).isEqualTo("ERROR");
    }
}
