package io.github.drompincen.agentbridge.runtime.transport.task;

import io.github.drompincen.agentbridge.protocol.api.Message;
import io.github.drompincen.agentbridge.protocol.api.TaskStatus;

import java.util.List;

/**
 * Task object as returned by the task protocol ({@code message/send}, {@code tasks/get}).
 */
public record RemoteTask(String id, String contextId, TaskStatus status, List<Message> history) {

    public RemoteTask {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
