package io.github.drompincen.agentbridge.runtime.transport;

import io.github.drompincen.agentbridge.protocol.api.ConversationSnapshot;
import io.github.drompincen.agentbridge.protocol.api.Part;
import io.github.drompincen.agentbridge.protocol.api.SendOptions;
import io.github.drompincen.agentbridge.protocol.api.SendResult;
import io.github.drompincen.agentbridge.protocol.api.Tick;
import io.github.drompincen.agentbridge.protocol.api.TransportKind;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;

/**
 * Uniform view of a conversation regardless of the wire protocol behind it.
 *
 * <p>Callers send with {@link #send}, then consume {@link #ticks} and re-fetch
 * {@link #snapshot} on every tick. Sends against one adapter must not be pipelined.
 */
public interface TransportAdapter {

    TransportKind kind();

    /**
     * Posts a message. Without {@code options.taskId()} a new conversation is started.
     *
     * @throws ConversationEndedException if the conversation is already in a terminal state
     * @throws TransportException         if the underlying client fails
     */
    SendResult send(List<Part> parts, SendOptions options);

    /** Current snapshot, or empty if the conversation does not exist (yet). */
    Optional<ConversationSnapshot> snapshot(String taskId);

    /** Cancels the conversation. Idempotent, and the only operation allowed once terminal. */
    void cancel(String taskId);

    /**
     * Content-free change notifications, in order, at least once. Completes when
     * {@code token} fires or the conversation's stream ends.
     */
    Flux<Tick> ticks(String taskId, CancelToken token);
}
