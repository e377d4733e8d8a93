package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * File payload of a {@link FilePart}: either inline base64 {@code bytes} or a remote {@code uri}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileContent(String bytes, String uri, String name, String mimeType) {

    public FileContent {
        if ((bytes == null) == (uri == null)) {
            throw new IllegalArgumentException("exactly one of bytes or uri must be set");
        }
    }

    public static FileContent inline(String base64Bytes, String name, String mimeType) {
        return new FileContent(base64Bytes, null, name, mimeType);
    }

    public static FileContent remote(String uri, String name, String mimeType) {
        return new FileContent(null, uri, name, mimeType);
    }

    @JsonIgnore
    public boolean isInline() {
        return bytes != null;
    }
}
