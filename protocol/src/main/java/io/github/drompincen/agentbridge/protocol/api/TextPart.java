package io.github.drompincen.agentbridge.protocol.api;

import java.util.Objects;

public record TextPart(String text) implements Part {

    public TextPart {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String kind() {
        return "text";
    }
}
