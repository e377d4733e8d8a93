package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import io.github.drompincen.agentbridge.protocol.api.ConversationSnapshot;
import io.github.drompincen.agentbridge.protocol.api.Message;
import io.github.drompincen.agentbridge.protocol.api.TaskState;
import io.github.drompincen.agentbridge.protocol.api.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The synthetic task owned by one {@link ToolCallTransportAdapter}. Never shared; every
 * snapshot is built from a copy.
 */
final class ToolCallConversationState {

    private String conversationId;
    private final List<Message> messages = new ArrayList<>();
    private TaskState status = TaskState.SUBMITTED;
    private String lastReplySignature;

    synchronized String conversationId() {
        return conversationId;
    }

    synchronized TaskState status() {
        return status;
    }

    synchronized void begin(String newConversationId) {
        conversationId = newConversationId;
        status = TaskState.SUBMITTED;
    }

    synchronized boolean containsMessageId(String messageId) {
        for (Message m : messages) {
            if (m.messageId().equals(messageId)) return true;
        }
        return false;
    }

    synchronized void append(Message message) {
        messages.add(message);
    }

    /** Moves to {@code next} unless already terminal. Returns true if the status changed. */
    synchronized boolean advance(TaskState next) {
        if (status.isTerminal() || status == next) return false;
        status = next;
        return true;
    }

    synchronized boolean isDuplicateReply(String signature) {
        return signature.equals(lastReplySignature);
    }

    synchronized void rememberReply(String signature) {
        lastReplySignature = signature;
    }

    synchronized void reset() {
        conversationId = null;
        messages.clear();
        status = TaskState.SUBMITTED;
        lastReplySignature = null;
    }

    /** Latest message becomes {@code status.message}; everything before it is history. */
    synchronized Optional<ConversationSnapshot> snapshot() {
        if (conversationId == null) return Optional.empty();
        Message latest = messages.isEmpty() ? null : messages.get(messages.size() - 1);
        List<Message> history = messages.isEmpty()
                ? List.of()
                : new ArrayList<>(messages.subList(0, messages.size() - 1));
        return Optional.of(new ConversationSnapshot(conversationId, new TaskStatus(status, latest), history));
    }
}
