package io.github.drompincen.agentbridge.persistence.repository;

import io.github.drompincen.agentbridge.persistence.document.ConversationEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ConversationEventRepository extends MongoRepository<ConversationEventDocument, String> {
    List<ConversationEventDocument> findByConversationIdOrderBySeqAsc(long conversationId);
    Optional<ConversationEventDocument> findTopByConversationIdOrderBySeqDesc(long conversationId);
}
