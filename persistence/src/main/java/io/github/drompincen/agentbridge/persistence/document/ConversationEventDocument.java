package io.github.drompincen.agentbridge.persistence.document;

import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.protocol.event.ConversationEventType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "conversation_events")
@CompoundIndex(name = "conversation_seq", def = "{'conversationId': 1, 'seq': 1}", unique = true)
public class ConversationEventDocument {

    @Id
    private String eventId;
    private long conversationId;
    private long seq;
    private ConversationEventType type;
    private Finality finality;
    private String agentId;
    private Object payload;
    private Instant timestamp;

    public ConversationEventDocument() {}

    public ConversationEvent toEvent() {
        return new ConversationEvent(eventId, conversationId, seq, type, finality, agentId, timestamp);
    }

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public long getConversationId() { return conversationId; }
    public void setConversationId(long conversationId) { this.conversationId = conversationId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public ConversationEventType getType() { return type; }
    public void setType(ConversationEventType type) { this.type = type; }

    public Finality getFinality() { return finality; }
    public void setFinality(Finality finality) { this.finality = finality; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public Object getPayload() { return payload; }
    public void setPayload(Object payload) { this.payload = payload; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
