package io.github.drompincen.agentbridge.runtime.lifecycle;

@FunctionalInterface
public interface AgentWorkerFactory {
    AgentWorker create(long conversationId, String agentId);
}
