package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import io.github.drompincen.agentbridge.runtime.transport.EndpointConfig;

@FunctionalInterface
public interface ToolCallProtocolClientFactory {
    ToolCallProtocolClient create(EndpointConfig config);
}
