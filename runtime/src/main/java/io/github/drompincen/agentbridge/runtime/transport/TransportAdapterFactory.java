package io.github.drompincen.agentbridge.runtime.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentbridge.protocol.api.TransportKind;
import io.github.drompincen.agentbridge.runtime.transport.task.TaskProtocolClientFactory;
import io.github.drompincen.agentbridge.runtime.transport.task.TaskTransportAdapter;
import io.github.drompincen.agentbridge.runtime.transport.toolcall.ToolCallProtocolClientFactory;
import io.github.drompincen.agentbridge.runtime.transport.toolcall.ToolCallTransportAdapter;
import reactor.core.scheduler.Scheduler;

/**
 * Builds one adapter per conversation from configured defaults and the injected wire clients.
 */
public class TransportAdapterFactory {

    private final TransportSettings settings;
    private final TaskProtocolClientFactory taskClients;
    private final ToolCallProtocolClientFactory toolCallClients;
    private final Scheduler pollScheduler;
    private final ObjectMapper objectMapper;

    public TransportAdapterFactory(TransportSettings settings,
                                   TaskProtocolClientFactory taskClients,
                                   ToolCallProtocolClientFactory toolCallClients,
                                   Scheduler pollScheduler,
                                   ObjectMapper objectMapper) {
        this.settings = settings;
        this.taskClients = taskClients;
        this.toolCallClients = toolCallClients;
        this.pollScheduler = pollScheduler;
        this.objectMapper = objectMapper;
    }

    public TransportAdapter create(TransportKind kind) {
        return create(kind, null);
    }

    /** {@code endpointOverride} replaces the configured endpoint when non-blank. */
    public TransportAdapter create(TransportKind kind, String endpointOverride) {
        return switch (kind) {
            case TASK -> {
                if (taskClients == null) {
                    throw new IllegalStateException("No task protocol client configured");
                }
                yield new TaskTransportAdapter(taskClients.create(resolve(settings.task(), endpointOverride)));
            }
            case TOOL_CALL -> {
                if (toolCallClients == null) {
                    throw new IllegalStateException("No tool-call protocol client configured");
                }
                yield new ToolCallTransportAdapter(
                        toolCallClients.create(resolve(settings.toolCall(), endpointOverride)),
                        settings.checkRepliesWait(), settings.pollBackoff(), pollScheduler, objectMapper);
            }
        };
    }

    private static EndpointConfig resolve(EndpointConfig base, String override) {
        if (override == null || override.isBlank()) return base;
        return base.withEndpoint(override);
    }
}
