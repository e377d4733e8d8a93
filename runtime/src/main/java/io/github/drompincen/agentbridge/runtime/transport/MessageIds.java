package io.github.drompincen.agentbridge.runtime.transport;

import java.util.UUID;

public final class MessageIds {

    private MessageIds() {}

    public static String next() {
        return "m-" + UUID.randomUUID();
    }

    public static String orNext(String supplied) {
        return supplied == null || supplied.isBlank() ? next() : supplied;
    }
}
