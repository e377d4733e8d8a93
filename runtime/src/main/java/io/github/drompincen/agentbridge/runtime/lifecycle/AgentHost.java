package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.protocol.api.RuntimeAgentInfo;

import java.util.Collection;
import java.util.List;

/**
 * Process-local supervisor of agent workers. Holds no durable state.
 *
 * <p>There is deliberately no per-agent stop: {@link #stop(long)} always stops every worker
 * of the conversation.
 */
public interface AgentHost {

    /** Starts whichever of {@code agentIds} are not already running for the conversation. */
    void ensure(long conversationId, Collection<String> agentIds);

    /** Stops all workers of the conversation; no-op when none are running. */
    void stop(long conversationId);

    List<RuntimeAgentInfo> list(long conversationId);

    void stopAll();
}
