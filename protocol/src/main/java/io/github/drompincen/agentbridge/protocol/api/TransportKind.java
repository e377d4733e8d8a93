package io.github.drompincen.agentbridge.protocol.api;

public enum TransportKind {
    /** Stateful task protocol with server-pushed status. */
    TASK,
    /** Stateless tool-call protocol with long-poll replies. */
    TOOL_CALL
}
