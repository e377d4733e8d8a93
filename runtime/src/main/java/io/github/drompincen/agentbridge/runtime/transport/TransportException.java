package io.github.drompincen.agentbridge.runtime.transport;

/**
 * Failure talking to a protocol client (network, HTTP status, malformed envelope).
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
