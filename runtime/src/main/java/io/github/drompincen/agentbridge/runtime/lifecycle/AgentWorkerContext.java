package io.github.drompincen.agentbridge.runtime.lifecycle;

import java.util.function.BooleanSupplier;

public record AgentWorkerContext(long conversationId, String agentId, BooleanSupplier stopRequested) {

    public boolean isStopRequested() {
        return stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted();
    }
}
