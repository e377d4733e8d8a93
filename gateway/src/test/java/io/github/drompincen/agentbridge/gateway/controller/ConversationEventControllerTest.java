package io.github.drompincen.agentbridge.gateway.controller;

import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.protocol.event.ConversationEventType;
import io.github.drompincen.agentbridge.runtime.event.ConversationEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationEventControllerTest {

    @Mock private ConversationEventPublisher publisher;

    private ConversationEventController controller;

    @BeforeEach
    void setUp() {
        controller = new ConversationEventController(publisher);
    }

    @Test
    void publishesMessageWithFinality() {
        ConversationEvent event = ConversationEvent.message(42L, 1, "a", Finality.CONVERSATION);
        when(publisher.publish(42L, ConversationEventType.MESSAGE, Finality.CONVERSATION, "a", "bye"))
                .thenReturn(event);

        ResponseEntity<ConversationEvent> response = controller.publish(42L,
                Map.of("type", "message", "finality", "conversation", "agentId", "a", "payload", "bye"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(event);
    }

    @Test
    void defaultsToMessageWithoutFinality() {
        controller.publish(1L, Map.of());

        verify(publisher).publish(1L, ConversationEventType.MESSAGE, Finality.NONE, null, null);
    }

    @Test
    void unknownFinalityIsBadRequest() {
        ResponseEntity<?> response = controller.publish(1L, Map.of("finality", "forever"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        verify(publisher, never()).publish(anyLong(), any(), any(), any(), any());
    }
}
