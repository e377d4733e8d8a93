package io.github.drompincen.agentbridge.protocol.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.drompincen.agentbridge.protocol.api.Finality;

import java.time.Instant;

/**
 * An entry of a conversation's event log. {@code finality} is only meaningful for
 * {@link ConversationEventType#MESSAGE} events.
 */
public record ConversationEvent(
        String eventId,
        long conversation,
        long seq,
        ConversationEventType type,
        Finality finality,
        String agentId,
        Instant timestamp
) {
    public static ConversationEvent message(long conversation, long seq, String agentId, Finality finality) {
        return new ConversationEvent(null, conversation, seq, ConversationEventType.MESSAGE,
                finality, agentId, Instant.now());
    }

    /** True for a message event whose finality ends the whole conversation. */
    @JsonIgnore
    public boolean endsConversation() {
        return type == ConversationEventType.MESSAGE && finality == Finality.CONVERSATION;
    }
}
