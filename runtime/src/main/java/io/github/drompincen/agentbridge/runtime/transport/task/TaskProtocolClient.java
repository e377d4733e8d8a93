package io.github.drompincen.agentbridge.runtime.transport.task;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentbridge.protocol.api.Part;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wire client for the task protocol. Implementations own encoding, auth and retries and
 * report failures as {@link io.github.drompincen.agentbridge.runtime.transport.TransportException}.
 */
public interface TaskProtocolClient {

    /** Creates a task when {@code taskId} is null, otherwise continues it. */
    RemoteTask sendMessage(List<Part> parts, String taskId, String messageId, Map<String, Object> metadata);

    Optional<RemoteTask> getTask(String taskId);

    void cancelTask(String taskId);

    /** Server-pushed frames (task, status-update or message) for one task. */
    Flux<JsonNode> resubscribe(String taskId);
}
