package io.github.drompincen.agentbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatus(TaskState state, Message message) {

    public TaskStatus {
        Objects.requireNonNull(state, "state");
    }

    public static TaskStatus of(TaskState state) {
        return new TaskStatus(state, null);
    }

    public Optional<Message> latest() {
        return Optional.ofNullable(message);
    }

    public TaskStatus withState(TaskState newState) {
        return new TaskStatus(newState, message);
    }
}
