package io.github.drompincen.agentbridge.runtime.event;

import io.github.drompincen.agentbridge.persistence.document.ConversationEventDocument;
import io.github.drompincen.agentbridge.persistence.repository.ConversationEventRepository;
import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.protocol.event.ConversationEventType;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Appends events to a conversation's log with a per-conversation monotonic {@code seq}.
 */
@Service
public class ConversationEventPublisher {

    private final ConversationEventRepository eventRepository;
    private final ConcurrentHashMap<Long, AtomicLong> seqCounters = new ConcurrentHashMap<>();

    public ConversationEventPublisher(ConversationEventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    public ConversationEvent publish(long conversationId, ConversationEventType type, Finality finality,
                                     String agentId, Object payload) {
        long seq = seqCounters
                .computeIfAbsent(conversationId, k -> {
                    long last = eventRepository.findTopByConversationIdOrderBySeqDesc(conversationId)
                            .map(ConversationEventDocument::getSeq).orElse(0L);
                    return new AtomicLong(last);
                }).incrementAndGet();

        ConversationEventDocument doc = new ConversationEventDocument();
        doc.setEventId(UUID.randomUUID().toString());
        doc.setConversationId(conversationId);
        doc.setSeq(seq);
        doc.setType(type);
        doc.setFinality(type == ConversationEventType.MESSAGE
                ? (finality == null ? Finality.NONE : finality) : null);
        doc.setAgentId(agentId);
        doc.setPayload(payload == null ? Map.of() : payload);
        doc.setTimestamp(Instant.now());
        return eventRepository.save(doc).toEvent();
    }

    public ConversationEvent publishMessage(long conversationId, String agentId, Finality finality, Object payload) {
        return publish(conversationId, ConversationEventType.MESSAGE, finality, agentId, payload);
    }

    public List<ConversationEvent> history(long conversationId) {
        return eventRepository.findByConversationIdOrderBySeqAsc(conversationId).stream()
                .map(ConversationEventDocument::toEvent)
                .toList();
    }
}
