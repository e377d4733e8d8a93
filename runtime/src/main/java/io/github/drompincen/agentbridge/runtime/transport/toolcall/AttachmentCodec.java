package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentbridge.protocol.api.FileContent;
import io.github.drompincen.agentbridge.protocol.api.FilePart;
import io.github.drompincen.agentbridge.protocol.api.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Converts between file parts (base64 bytes) and the tool-call protocol's inline text attachments.
 */
final class AttachmentCodec {

    private static final Logger log = LoggerFactory.getLogger(AttachmentCodec.class);
    static final String DEFAULT_MIME = "text/plain";
    static final String REMOTE_PLACEHOLDER = "[remote file: uri omitted]";

    private final ObjectMapper objectMapper;

    AttachmentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    List<WireAttachment> toWire(List<Part> parts) {
        List<WireAttachment> out = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof FilePart filePart) {
                out.add(toWire(filePart.file()));
            }
        }
        return out;
    }

    WireAttachment toWire(FileContent file) {
        String name = file.name() != null && !file.name().isBlank() ? file.name() : randomName() + ".txt";
        String mime = file.mimeType() != null && !file.mimeType().isBlank() ? file.mimeType() : DEFAULT_MIME;
        String content;
        if (file.isInline()) {
            try {
                content = new String(Base64.getDecoder().decode(file.bytes()), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                log.warn("Attachment {} has invalid base64 content, sending empty content", name);
                content = "";
            }
        } else {
            content = REMOTE_PLACEHOLDER;
        }
        return new WireAttachment(name, mime, content);
    }

    /** Empty when the attachment cannot be represented; the rest of the reply still goes through. */
    Optional<FilePart> fromWire(WireAttachment attachment) {
        if (attachment == null) return Optional.empty();
        try {
            String name = attachment.name() != null && !attachment.name().isBlank() ? attachment.name() : randomName();
            String mime = attachment.contentType() != null && !attachment.contentType().isBlank()
                    ? attachment.contentType() : DEFAULT_MIME;
            String text = contentAsText(attachment.content());
            String b64 = Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
            return Optional.of(new FilePart(FileContent.inline(b64, name, mime)));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Dropping malformed attachment {}: {}", attachment.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private String contentAsText(Object content) throws JsonProcessingException {
        if (content == null) return "{}";
        if (content instanceof String s) return s;
        return objectMapper.writeValueAsString(content);
    }

    private static String randomName() {
        return "file-" + Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36, 36 * 36 * 36 * 36 * 36), 36);
    }
}
