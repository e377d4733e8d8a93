package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Attachment in the tool-call protocol's flat message shape. {@code content} is normally
 * text but arrives as arbitrary JSON from some servers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireAttachment(String name, String contentType, Object content, String summary) {

    public WireAttachment(String name, String contentType, String content) {
        this(name, contentType, content, null);
    }
}
