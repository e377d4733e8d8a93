package io.github.drompincen.agentbridge.protocol.api;

/**
 * Content-free change notification: the consumer should re-fetch the snapshot.
 */
public enum Tick {
    INSTANCE
}
