package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Result of one bounded {@code check_replies} long-poll. */
public record ReplyBatch(
        List<WireReply> messages,
        String status,
        @JsonProperty("conversation_ended") boolean conversationEnded
) {
    public ReplyBatch {
        messages = messages == null ? List.of() : messages;
    }
}
