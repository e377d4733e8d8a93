package io.github.drompincen.agentbridge.runtime.transport;

import java.time.Duration;

/**
 * Process-wide adapter defaults, supplied once at the outermost wiring point.
 */
public record TransportSettings(
        EndpointConfig task,
        EndpointConfig toolCall,
        Duration checkRepliesWait,
        Duration pollBackoff
) {}
