package io.github.drompincen.agentbridge.runtime.lifecycle;

/**
 * Starting or stopping agent workers failed; surfaced to the caller of ensure/stop.
 */
public class LifecycleException extends RuntimeException {

    public LifecycleException(String message) {
        super(message);
    }

    public LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
