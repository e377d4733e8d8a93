package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;

@FunctionalInterface
public interface ConversationEventListener {
    void onEvent(ConversationEvent event);
}
