package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    USER("user"),
    AGENT("agent");

    private final String wireValue;

    MessageRole(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static MessageRole fromWire(String value) {
        for (MessageRole role : values()) {
            if (role.wireValue.equalsIgnoreCase(value)) return role;
        }
        throw new IllegalArgumentException("Unknown message role: " + value);
    }
}
