package io.github.drompincen.agentbridge.persistence.stream;

import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;

public interface ConversationEventStreamListener {
    void onEvent(ConversationEvent event);
    default void onError(Throwable t) {}
}
