package io.github.drompincen.agentbridge.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_CONVERSATION,
    UNSUBSCRIBE,

    // Server -> Client
    TICK,
    SUBSCRIBED,
    UNSUBSCRIBED,
    ERROR
}
