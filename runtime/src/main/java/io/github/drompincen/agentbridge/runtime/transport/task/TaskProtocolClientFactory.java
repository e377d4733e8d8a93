package io.github.drompincen.agentbridge.runtime.transport.task;

import io.github.drompincen.agentbridge.runtime.transport.EndpointConfig;

@FunctionalInterface
public interface TaskProtocolClientFactory {
    TaskProtocolClient create(EndpointConfig config);
}
