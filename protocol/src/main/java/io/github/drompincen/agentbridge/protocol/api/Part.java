package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One piece of message content. Serialized with a {@code kind} discriminator
 * ({@code text}, {@code file} or {@code data}) so wire payloads are validated
 * at the adapter boundary instead of being passed around as loose maps.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextPart.class, name = "text"),
        @JsonSubTypes.Type(value = FilePart.class, name = "file"),
        @JsonSubTypes.Type(value = DataPart.class, name = "data")
})
public interface Part {

    String kind();
}
