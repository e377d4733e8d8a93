package io.github.drompincen.agentbridge.runtime.transport.toolcall;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentbridge.protocol.api.ConversationSnapshot;
import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.api.Message;
import io.github.drompincen.agentbridge.protocol.api.MessageRole;
import io.github.drompincen.agentbridge.protocol.api.Part;
import io.github.drompincen.agentbridge.protocol.api.SendOptions;
import io.github.drompincen.agentbridge.protocol.api.SendResult;
import io.github.drompincen.agentbridge.protocol.api.TaskState;
import io.github.drompincen.agentbridge.protocol.api.TextPart;
import io.github.drompincen.agentbridge.protocol.api.Tick;
import io.github.drompincen.agentbridge.protocol.api.TransportKind;
import io.github.drompincen.agentbridge.runtime.transport.CancelToken;
import io.github.drompincen.agentbridge.runtime.transport.ConversationEndedException;
import io.github.drompincen.agentbridge.runtime.transport.MessageIds;
import io.github.drompincen.agentbridge.runtime.transport.TransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapter over the stateless tool-call protocol. The wire has no task, so the adapter keeps
 * a private synthetic one ({@link ToolCallConversationState}) and discovers replies by
 * long-polling {@code check_replies} inside {@link #ticks}.
 */
public class ToolCallTransportAdapter implements TransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(ToolCallTransportAdapter.class);

    public static final Duration DEFAULT_WAIT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(800);

    private final ToolCallProtocolClient client;
    private final Duration checkRepliesWait;
    private final Duration pollBackoff;
    private final Scheduler scheduler;
    private final AttachmentCodec attachments;
    private final ToolCallConversationState state = new ToolCallConversationState();
    private volatile Sinks.One<Boolean> nextSend = Sinks.one();

    public ToolCallTransportAdapter(ToolCallProtocolClient client) {
        this(client, DEFAULT_WAIT, DEFAULT_BACKOFF, Schedulers.boundedElastic(), new ObjectMapper());
    }

    public ToolCallTransportAdapter(ToolCallProtocolClient client, Duration checkRepliesWait, Duration pollBackoff,
                                    Scheduler scheduler, ObjectMapper objectMapper) {
        this.client = client;
        this.checkRepliesWait = checkRepliesWait;
        this.pollBackoff = pollBackoff;
        this.scheduler = scheduler;
        this.attachments = new AttachmentCodec(objectMapper);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.TOOL_CALL;
    }

    @Override
    public SendResult send(List<Part> parts, SendOptions options) {
        TaskState current = state.status();
        if (current.isTerminal()) {
            throw new ConversationEndedException(state.conversationId(), current);
        }
        String messageId = MessageIds.orNext(options.messageId());
        if (state.containsMessageId(messageId)) {
            throw new IllegalArgumentException("messageId " + messageId + " already used in this conversation");
        }

        String conversationId = state.conversationId();
        if (conversationId == null) {
            String assigned = client.beginChatThread();
            conversationId = assigned != null && !assigned.isBlank() ? assigned : "conv-" + UUID.randomUUID();
            state.begin(conversationId);
            log.info("Began tool-call conversation {}", conversationId);
        }

        client.sendMessage(conversationId, joinText(parts), attachments.toWire(parts));

        state.append(new Message(MessageRole.USER, parts, messageId, conversationId, conversationId, null));
        state.advance(options.finality() == Finality.CONVERSATION ? TaskState.COMPLETED : TaskState.WORKING);
        wakePausedPoll();

        ConversationSnapshot snapshot = state.snapshot().orElseThrow();
        return new SendResult(conversationId, snapshot);
    }

    @Override
    public Optional<ConversationSnapshot> snapshot(String taskId) {
        return state.snapshot();
    }

    /** Local only: the protocol has no cancel, so the synthetic task is discarded. */
    @Override
    public void cancel(String taskId) {
        String previous = state.conversationId();
        state.reset();
        wakePausedPoll();
        if (previous != null) {
            log.info("Discarded tool-call conversation {}", previous);
        }
    }

    @Override
    public Flux<Tick> ticks(String taskId, CancelToken token) {
        AtomicBoolean ended = new AtomicBoolean(false);
        return Flux.defer(() -> pollRound(token, ended))
                .repeat(() -> !token.isCancelled() && !ended.get())
                .takeUntilOther(token.whenCancelled());
    }

    private Flux<Tick> pollRound(CancelToken token, AtomicBoolean ended) {
        if (token.isCancelled()) return Flux.empty();
        Sinks.One<Boolean> resume = nextSend;
        String conversationId = state.conversationId();
        if (conversationId == null) {
            // nothing to poll until the first send assigns an identity
            return resume.asMono().thenMany(Flux.<Tick>empty());
        }
        return Mono.fromCallable(() -> client.checkReplies(conversationId, checkRepliesWait.toMillis()))
                .subscribeOn(scheduler)
                .onErrorResume(e -> {
                    log.warn("check_replies failed for {}, retrying in {}ms: {}",
                            conversationId, pollBackoff.toMillis(), e.getMessage());
                    return Mono.delay(pollBackoff, scheduler).then(Mono.<ReplyBatch>empty());
                })
                .flatMapMany(batch -> Flux.fromIterable(applyBatch(conversationId, batch, ended)))
                .concatWith(Mono.defer(this::pauseWhileInputRequired).thenMany(Flux.<Tick>empty()));
    }

    List<Tick> applyBatch(String conversationId, ReplyBatch batch, AtomicBoolean ended) {
        List<Tick> ticks = new ArrayList<>();
        if (!conversationId.equals(state.conversationId())) {
            // canceled or restarted while the poll was in flight
            return ticks;
        }
        boolean changed = false;
        for (WireReply reply : batch.messages()) {
            String signature = signature(reply);
            if (state.isDuplicateReply(signature)) continue;
            state.append(decode(reply, conversationId));
            state.rememberReply(signature);
            changed = true;
        }
        if (batch.status() != null && !batch.status().isBlank()) {
            TaskState reported = TaskState.fromWire(batch.status());
            if (reported == TaskState.UNKNOWN) {
                log.debug("Ignoring unrecognised status '{}' for {}", batch.status(), conversationId);
            } else if (state.advance(reported)) {
                changed = true;
            }
        }
        if (changed) ticks.add(Tick.INSTANCE);
        if (batch.conversationEnded()) {
            state.advance(TaskState.COMPLETED);
            ended.set(true);
            ticks.add(Tick.INSTANCE);
            log.info("Tool-call conversation {} ended", conversationId);
        }
        return ticks;
    }

    Message decode(WireReply reply, String conversationId) {
        List<Part> parts = new ArrayList<>();
        String text = reply.text() != null ? reply.text() : "";
        if (!text.isEmpty()) parts.add(new TextPart(text));
        for (WireAttachment attachment : reply.attachments()) {
            attachments.fromWire(attachment).ifPresent(parts::add);
        }
        return new Message(MessageRole.AGENT, parts, MessageIds.next(), conversationId, conversationId, null);
    }

    private Mono<Boolean> pauseWhileInputRequired() {
        Sinks.One<Boolean> resume = nextSend;
        if (state.status() != TaskState.INPUT_REQUIRED) return Mono.empty();
        return resume.asMono();
    }

    private void wakePausedPoll() {
        Sinks.One<Boolean> current = nextSend;
        nextSend = Sinks.one();
        current.tryEmitValue(Boolean.TRUE);
    }

    private static String joinText(List<Part> parts) {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof TextPart textPart) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(textPart.text());
            }
        }
        return sb.toString();
    }

    private static String signature(WireReply reply) {
        StringBuilder sb = new StringBuilder(reply.text() == null ? "" : reply.text());
        for (WireAttachment a : reply.attachments()) {
            if (a == null) continue;
            sb.append('\u0000').append(a.name()).append('|').append(a.contentType()).append('|').append(a.content());
        }
        return sb.toString();
    }
}
