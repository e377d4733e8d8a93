package io.github.drompincen.agentbridge.protocol.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConversationEventType {
    MESSAGE("message"),
    TRACE("trace"),
    SYSTEM("system");

    private final String wireValue;

    ConversationEventType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ConversationEventType fromWire(String value) {
        for (ConversationEventType t : values()) {
            if (t.wireValue.equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown conversation event type: " + value);
    }
}
