package io.github.drompincen.agentbridge.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "agent_registrations")
@CompoundIndex(name = "conversation_agent", def = "{'conversationId': 1, 'agentId': 1}", unique = true)
public class AgentRegistrationDocument {

    @Id
    private String registrationId;
    private long conversationId;
    private String agentId;
    private Instant registeredAt;

    public AgentRegistrationDocument() {}

    public AgentRegistrationDocument(long conversationId, String agentId) {
        this.registrationId = conversationId + ":" + agentId;
        this.conversationId = conversationId;
        this.agentId = agentId;
        this.registeredAt = Instant.now();
    }

    public String getRegistrationId() { return registrationId; }
    public void setRegistrationId(String registrationId) { this.registrationId = registrationId; }

    public long getConversationId() { return conversationId; }
    public void setConversationId(long conversationId) { this.conversationId = conversationId; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public Instant getRegisteredAt() { return registeredAt; }
    public void setRegisteredAt(Instant registeredAt) { this.registeredAt = registeredAt; }
}
