package io.github.drompincen.agentbridge.runtime.lifecycle;

/**
 * A long-running agent bound to one conversation. {@link #run} should return promptly once
 * the thread is interrupted or {@link AgentWorkerContext#isStopRequested()} turns true.
 */
@FunctionalInterface
public interface AgentWorker {
    void run(AgentWorkerContext context) throws Exception;
}
