package io.github.drompincen.agentbridge.protocol.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of one conversation as observed at a point in time.
 * {@code history} runs oldest to newest and never contains {@code status.message}.
 */
public record ConversationSnapshot(String id, TaskStatus status, List<Message> history) {

    public ConversationSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        history = history == null ? List.of() : List.copyOf(history);
        if (status.message() != null) {
            String latestId = status.message().messageId();
            for (Message m : history) {
                if (latestId.equals(m.messageId())) {
                    throw new IllegalArgumentException(
                            "status message " + latestId + " must not also appear in history");
                }
            }
        }
    }

    public TaskState state() {
        return status.state();
    }

    public boolean isTerminal() {
        return status.state().isTerminal();
    }

    /** History plus the latest message, in order. */
    public List<Message> allMessages() {
        if (status.message() == null) return history;
        var all = new ArrayList<>(history);
        all.add(status.message());
        return List.copyOf(all);
    }
}
