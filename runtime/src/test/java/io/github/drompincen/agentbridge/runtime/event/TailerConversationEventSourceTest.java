package io.github.drompincen.agentbridge.runtime.event;

import io.github.drompincen.agentbridge.persistence.stream.ConversationEventChangeStreamTailer;
import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.runtime.lifecycle.ConversationEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class TailerConversationEventSourceTest {

    private ConversationEventChangeStreamTailer tailer;
    private TailerConversationEventSource source;

    @BeforeEach
    void setUp() {
        // never started; events are injected through dispatch
        tailer = new ConversationEventChangeStreamTailer(mock(MongoTemplate.class));
        source = new TailerConversationEventSource(tailer);
    }

    @Test
    void subscriberReceivesDispatchedEvents() {
        List<ConversationEvent> received = new CopyOnWriteArrayList<>();
        source.subscribeAll(received::add);
        ConversationEvent event = ConversationEvent.message(42L, 1, "a", Finality.CONVERSATION);

        tailer.dispatch(event);

        assertThat(received).containsExactly(event);
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() {
        List<ConversationEvent> received = new CopyOnWriteArrayList<>();
        ConversationEventListener failing = e -> {
            throw new IllegalStateException("boom");
        };
        source.subscribeAll(failing);
        source.subscribeAll(received::add);

        tailer.dispatch(ConversationEvent.message(1L, 1, "a", Finality.TURN));

        assertThat(received).hasSize(1);
    }

    @Test
    void unsubscribeDetachesListener() {
        String id = source.subscribeAll(e -> { });

        assertThat(tailer.listenerCount()).isEqualTo(1);
        source.unsubscribe(id);
        source.unsubscribe(id);

        assertThat(tailer.listenerCount()).isZero();
    }
}
