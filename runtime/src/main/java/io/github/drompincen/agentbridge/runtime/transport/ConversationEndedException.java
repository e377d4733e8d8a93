package io.github.drompincen.agentbridge.runtime.transport;

import io.github.drompincen.agentbridge.protocol.api.TaskState;

/**
 * Raised by {@code send} when the conversation has already reached a terminal state.
 */
public class ConversationEndedException extends RuntimeException {

    private final String taskId;
    private final TaskState state;

    public ConversationEndedException(String taskId, TaskState state) {
        super("Conversation " + taskId + " ended (" + state.wireValue() + "); no further messages accepted");
        this.taskId = taskId;
        this.state = state;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getState() {
        return state;
    }
}
