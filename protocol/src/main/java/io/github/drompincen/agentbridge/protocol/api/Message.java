package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        MessageRole role,
        List<Part> parts,
        String messageId,
        String taskId,
        String contextId,
        Map<String, Object> metadata
) {
    public Message {
        Objects.requireNonNull(role, "role");
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be blank");
        }
        parts = parts == null ? List.of() : List.copyOf(parts);
        metadata = metadata == null ? null : Map.copyOf(metadata);
    }

    public Message(MessageRole role, List<Part> parts, String messageId) {
        this(role, parts, messageId, null, null, null);
    }

    /** Text parts joined with newlines; empty when the message carries none. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof TextPart textPart) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(textPart.text());
            }
        }
        return sb.toString();
    }
}
