package io.github.drompincen.agentbridge.runtime.transport.task;

import io.github.drompincen.agentbridge.protocol.api.ConversationSnapshot;
import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.api.Message;
import io.github.drompincen.agentbridge.protocol.api.Part;
import io.github.drompincen.agentbridge.protocol.api.SendOptions;
import io.github.drompincen.agentbridge.protocol.api.SendResult;
import io.github.drompincen.agentbridge.protocol.api.TaskState;
import io.github.drompincen.agentbridge.protocol.api.TaskStatus;
import io.github.drompincen.agentbridge.protocol.api.Tick;
import io.github.drompincen.agentbridge.protocol.api.TransportKind;
import io.github.drompincen.agentbridge.runtime.transport.CancelToken;
import io.github.drompincen.agentbridge.runtime.transport.ConversationEndedException;
import io.github.drompincen.agentbridge.runtime.transport.MessageIds;
import io.github.drompincen.agentbridge.runtime.transport.TransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapter over the stateful task protocol. Status and history come straight from the
 * server; the adapter only encodes finality, de-duplicates the latest message out of
 * history and keeps terminal states sticky.
 */
public class TaskTransportAdapter implements TransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(TaskTransportAdapter.class);

    /** Message metadata extension carrying the per-send finality hint. */
    public static final String FINALITY_EXTENSION = "https://chitchat.fhir.me/a2a-ext";

    private final TaskProtocolClient client;
    private final Map<String, TaskState> lastKnownStates = new ConcurrentHashMap<>();

    public TaskTransportAdapter(TaskProtocolClient client) {
        this.client = client;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.TASK;
    }

    @Override
    public SendResult send(List<Part> parts, SendOptions options) {
        String taskId = options.taskId();
        if (taskId != null) {
            TaskState known = lastKnownStates.get(taskId);
            if (known != null && known.isTerminal()) {
                throw new ConversationEndedException(taskId, known);
            }
        }
        String messageId = MessageIds.orNext(options.messageId());
        RemoteTask task = client.sendMessage(parts, taskId, messageId, finalityMetadata(options.finality()));
        ConversationSnapshot snapshot = toSnapshot(task);
        log.debug("Sent message {} to task {} -> {}", messageId, task.id(), snapshot.state().wireValue());
        return new SendResult(task.id(), snapshot);
    }

    @Override
    public Optional<ConversationSnapshot> snapshot(String taskId) {
        return client.getTask(taskId).map(this::toSnapshot);
    }

    @Override
    public void cancel(String taskId) {
        if (lastKnownStates.get(taskId) == TaskState.CANCELED) {
            return;
        }
        client.cancelTask(taskId);
        lastKnownStates.compute(taskId, (id, prev) -> prev != null && prev.isTerminal() ? prev : TaskState.CANCELED);
        log.info("Canceled task {}", taskId);
    }

    @Override
    public Flux<Tick> ticks(String taskId, CancelToken token) {
        return Flux.defer(() -> token.isCancelled()
                        ? Flux.<Tick>empty()
                        : client.resubscribe(taskId).map(frame -> Tick.INSTANCE))
                .takeUntilOther(token.whenCancelled());
    }

    static Map<String, Object> finalityMetadata(Finality finality) {
        return Map.of(FINALITY_EXTENSION, Map.of("finality", finality.wireValue()));
    }

    ConversationSnapshot toSnapshot(RemoteTask task) {
        TaskStatus incoming = task.status() != null ? task.status() : TaskStatus.of(TaskState.UNKNOWN);
        TaskState effective = lastKnownStates.merge(task.id(), incoming.state(),
                (prev, next) -> prev.isTerminal() ? prev : next);
        if (effective != incoming.state()) {
            log.warn("Task {} reported {} after terminal {}; keeping terminal state",
                    task.id(), incoming.state().wireValue(), effective.wireValue());
        }

        Message latest = incoming.message();
        List<Message> history = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (latest != null) seen.add(latest.messageId());
        for (Message m : task.history()) {
            if (seen.add(m.messageId())) history.add(m);
        }
        return new ConversationSnapshot(task.id(), new TaskStatus(effective, latest), history);
    }
}
