package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeAgentInfo(String agentId, String workerClass, Instant startedAt) {

    /** An agent that is registered but has no live worker yet. */
    public static RuntimeAgentInfo intended(String agentId) {
        return new RuntimeAgentInfo(agentId, null, null);
    }
}
