package io.github.drompincen.agentbridge.protocol.api;

import java.util.List;

public record EnsureAgentsRequest(List<String> agentIds) {}
