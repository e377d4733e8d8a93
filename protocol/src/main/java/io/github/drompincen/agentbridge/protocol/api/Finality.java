package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Per-send directive: keep the turn, hand over the turn, or end the conversation. */
public enum Finality {
    NONE("none"),
    TURN("turn"),
    CONVERSATION("conversation");

    private final String wireValue;

    Finality(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static Finality fromWire(String value) {
        if (value == null || value.isBlank()) return NONE;
        for (Finality f : values()) {
            if (f.wireValue.equalsIgnoreCase(value.trim())) return f;
        }
        throw new IllegalArgumentException("Unknown finality: " + value);
    }
}
