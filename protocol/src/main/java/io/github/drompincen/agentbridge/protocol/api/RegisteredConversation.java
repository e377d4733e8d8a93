package io.github.drompincen.agentbridge.protocol.api;

import java.util.List;

public record RegisteredConversation(long conversationId, List<String> agentIds) {

    public RegisteredConversation {
        agentIds = agentIds == null ? List.of() : List.copyOf(agentIds);
    }
}
