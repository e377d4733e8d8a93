package io.github.drompincen.agentbridge.persistence.stream;

import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.changestream.FullDocument;
import io.github.drompincen.agentbridge.persistence.document.ConversationEventDocument;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Tails inserts into {@code conversation_events} and fans them out to in-process listeners.
 * Falls back to timestamp polling when the deployment has no replica set (no change streams).
 * <p>
 * Polling re-reads a short window before the newest delivered timestamp and skips event ids it has
 * already delivered, so events sharing a timestamp or committed slightly late are not lost or repeated.
 */
@Component
public class ConversationEventChangeStreamTailer {

    private static final Logger log = LoggerFactory.getLogger(ConversationEventChangeStreamTailer.class);
    private static final String COLLECTION = "conversation_events";
    static final Duration POLL_LOOKBACK = Duration.ofSeconds(2);

    private final MongoTemplate mongoTemplate;
    private final List<ConversationEventStreamListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "conversation-event-tailer");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean running = false;

    // only touched from the tailer thread
    private Instant lastSeen = Instant.now();
    private final Map<String, Instant> delivered = new HashMap<>();

    public ConversationEventChangeStreamTailer(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void addListener(ConversationEventStreamListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConversationEventStreamListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @PostConstruct
    public void start() {
        running = true;
        executor.submit(this::tailChangeStream);
        log.info("Conversation event tailer started");
    }

    @PreDestroy
    public void stop() {
        running = false;
        executor.shutdownNow();
        log.info("Conversation event tailer stopped");
    }

    private void tailChangeStream() {
        while (running) {
            try {
                doTail();
            } catch (Exception e) {
                if (running) {
                    log.warn("Change stream interrupted, falling back to polling: {}", e.getMessage());
                    pollFallback();
                }
            }
        }
    }

    private void doTail() {
        var collection = mongoTemplate.getDb().getCollection(COLLECTION);
        var stream = collection.watch(
                List.of(Aggregates.match(Filters.eq("operationType", "insert")))
        ).fullDocument(FullDocument.UPDATE_LOOKUP);

        try (var cursor = stream.iterator()) {
            while (running && cursor.hasNext()) {
                var change = cursor.next();
                Document fullDoc = change.getFullDocument();
                if (fullDoc != null) {
                    ConversationEventDocument doc = mongoTemplate.getConverter()
                            .read(ConversationEventDocument.class, fullDoc);
                    deliver(doc);
                }
            }
        }
    }

    private void pollFallback() {
        log.info("Using polling fallback for conversation events from {}", lastSeen);
        while (running) {
            try {
                pollOnce();
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Polling fallback error", e);
                try { Thread.sleep(1000); } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /** Dispatches every not yet delivered event in the lookback window; returns how many were dispatched. */
    int pollOnce() {
        var events = mongoTemplate.find(
                Query.query(Criteria.where("timestamp").gte(lastSeen.minus(POLL_LOOKBACK)))
                        .with(Sort.by("timestamp", "seq")),
                ConversationEventDocument.class);
        int count = 0;
        for (ConversationEventDocument doc : events) {
            if (deliver(doc)) count++;
        }
        return count;
    }

    /** Dispatches {@code doc} unless it was already delivered, and advances the poll cursor. */
    boolean deliver(ConversationEventDocument doc) {
        Instant timestamp = doc.getTimestamp() != null ? doc.getTimestamp() : Instant.now();
        if (delivered.putIfAbsent(doc.getEventId(), timestamp) != null) return false;
        if (timestamp.isAfter(lastSeen)) {
            lastSeen = timestamp;
            Instant horizon = lastSeen.minus(POLL_LOOKBACK);
            delivered.values().removeIf(seenAt -> seenAt.isBefore(horizon));
        }
        dispatch(doc.toEvent());
        return true;
    }

    /** Delivers one event to every listener; a failing listener does not affect the others. */
    public void dispatch(ConversationEvent event) {
        for (ConversationEventStreamListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Listener error for conversation {} event {}", event.conversation(), event.seq(), e);
                listener.onError(e);
            }
        }
    }
}
