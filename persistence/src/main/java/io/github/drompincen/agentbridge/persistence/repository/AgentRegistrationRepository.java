package io.github.drompincen.agentbridge.persistence.repository;

import io.github.drompincen.agentbridge.persistence.document.AgentRegistrationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentRegistrationRepository extends MongoRepository<AgentRegistrationDocument, String> {
    List<AgentRegistrationDocument> findAllByOrderByConversationIdAscRegisteredAtAsc();
    List<AgentRegistrationDocument> findByConversationIdOrderByRegisteredAtAsc(long conversationId);
    boolean existsByConversationIdAndAgentId(long conversationId, String agentId);
    long deleteByConversationIdAndAgentId(long conversationId, String agentId);
    long deleteByConversationId(long conversationId);
}
