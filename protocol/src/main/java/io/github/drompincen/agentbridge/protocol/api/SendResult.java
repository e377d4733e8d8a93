package io.github.drompincen.agentbridge.protocol.api;

public record SendResult(String taskId, ConversationSnapshot snapshot) {}
