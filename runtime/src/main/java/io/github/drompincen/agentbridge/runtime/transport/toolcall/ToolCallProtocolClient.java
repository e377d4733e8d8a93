package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import java.util.List;

/**
 * Wire client for the tool-call protocol: three stateless tools, no task concept.
 * Failures surface as {@link io.github.drompincen.agentbridge.runtime.transport.TransportException}.
 */
public interface ToolCallProtocolClient {

    /** {@code begin_chat_thread}; returns the new conversation id, possibly null. */
    String beginChatThread();

    /** {@code send_message_to_chat_thread}. */
    void sendMessage(String conversationId, String text, List<WireAttachment> attachments);

    /** {@code check_replies}; blocks for at most {@code waitMs} waiting for replies. */
    ReplyBatch checkReplies(String conversationId, long waitMs);
}
