package io.github.drompincen.agentbridge.runtime.lifecycle;

/**
 * Subscribe-all feed of conversation events.
 */
public interface ConversationEventSource {

    /** Returns a subscription id for {@link #unsubscribe}. */
    String subscribeAll(ConversationEventListener listener);

    void unsubscribe(String subscriptionId);
}
