package io.github.drompincen.agentbridge.protocol.api;

public record SendOptions(String taskId, String messageId, Finality finality) {

    public SendOptions {
        if (finality == null) finality = Finality.NONE;
    }

    public static SendOptions newConversation() {
        return new SendOptions(null, null, Finality.NONE);
    }

    public static SendOptions continuing(String taskId, Finality finality) {
        return new SendOptions(taskId, null, finality);
    }
}
