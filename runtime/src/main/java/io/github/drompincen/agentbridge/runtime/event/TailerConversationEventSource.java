package io.github.drompincen.agentbridge.runtime.event;

import io.github.drompincen.agentbridge.persistence.stream.ConversationEventChangeStreamTailer;
import io.github.drompincen.agentbridge.persistence.stream.ConversationEventStreamListener;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.runtime.lifecycle.ConversationEventListener;
import io.github.drompincen.agentbridge.runtime.lifecycle.ConversationEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConversationEventSource} over the Mongo change-stream tailer.
 */
@Component
public class TailerConversationEventSource implements ConversationEventSource {

    private static final Logger log = LoggerFactory.getLogger(TailerConversationEventSource.class);

    private final ConversationEventChangeStreamTailer tailer;
    private final ConcurrentHashMap<String, ConversationEventStreamListener> subscriptions = new ConcurrentHashMap<>();

    public TailerConversationEventSource(ConversationEventChangeStreamTailer tailer) {
        this.tailer = tailer;
    }

    @Override
    public String subscribeAll(ConversationEventListener listener) {
        String id = UUID.randomUUID().toString();
        ConversationEventStreamListener adapter = new ConversationEventStreamListener() {
            @Override
            public void onEvent(ConversationEvent event) {
                listener.onEvent(event);
            }

            @Override
            public void onError(Throwable t) {
                log.warn("Subscriber {} failed: {}", id, t.getMessage());
            }
        };
        subscriptions.put(id, adapter);
        tailer.addListener(adapter);
        return id;
    }

    @Override
    public void unsubscribe(String subscriptionId) {
        ConversationEventStreamListener adapter = subscriptions.remove(subscriptionId);
        if (adapter != null) {
            tailer.removeListener(adapter);
        }
    }
}
