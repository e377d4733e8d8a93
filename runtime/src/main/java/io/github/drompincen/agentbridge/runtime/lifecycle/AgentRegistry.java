package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.protocol.api.RegisteredConversation;

import java.util.Collection;
import java.util.List;

/**
 * Durable record of which agents should be running for which conversation.
 * Authoritative across restarts; all operations are idempotent.
 */
public interface AgentRegistry {

    void register(long conversationId, Collection<String> agentIds);

    /** Null or empty {@code agentIds} clears the whole conversation. */
    void unregister(long conversationId, Collection<String> agentIds);

    default void unregister(long conversationId) {
        unregister(conversationId, null);
    }

    List<RegisteredConversation> listRegistered();

    List<String> listRegistered(long conversationId);
}
