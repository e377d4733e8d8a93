package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import java.util.List;

/** One reply returned by {@code check_replies}: {@code {from, at, text, attachments}}. */
public record WireReply(String from, String at, String text, List<WireAttachment> attachments) {

    public WireReply {
        attachments = attachments == null ? List.of() : attachments;
    }

    public static WireReply text(String text) {
        return new WireReply(null, null, text, List.of());
    }
}
