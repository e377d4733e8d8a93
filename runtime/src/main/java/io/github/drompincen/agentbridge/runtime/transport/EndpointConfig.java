package io.github.drompincen.agentbridge.runtime.transport;

/**
 * Where a protocol client connects and which model it asks for by default.
 */
public record EndpointConfig(String endpoint, String defaultModel) {

    public EndpointConfig withEndpoint(String newEndpoint) {
        return new EndpointConfig(newEndpoint, defaultModel);
    }
}
