package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskState {
    SUBMITTED("submitted"),
    WORKING("working"),
    INPUT_REQUIRED("input-required"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELED("canceled"),
    REJECTED("rejected"),
    AUTH_REQUIRED("auth-required"),
    UNKNOWN("unknown");

    private final String wireValue;

    TaskState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED || this == REJECTED;
    }

    /**
     * Lenient parse: accepts hyphen or underscore spellings and the tool-call
     * protocol's {@code waiting}. Anything unrecognised maps to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static TaskState fromWire(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toLowerCase().replace('_', '-');
        if ("waiting".equals(normalized)) return WORKING;
        if ("cancelled".equals(normalized)) return CANCELED;
        for (TaskState state : values()) {
            if (state.wireValue.equals(normalized)) return state;
        }
        return UNKNOWN;
    }
}
