package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.persistence.document.AgentRegistrationDocument;
import io.github.drompincen.agentbridge.persistence.repository.AgentRegistrationRepository;
import io.github.drompincen.agentbridge.protocol.api.RegisteredConversation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Service
public class MongoAgentRegistry implements AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(MongoAgentRegistry.class);

    private final AgentRegistrationRepository repository;

    public MongoAgentRegistry(AgentRegistrationRepository repository) {
        this.repository = repository;
    }

    @Override
    public void register(long conversationId, Collection<String> agentIds) {
        if (agentIds == null) return;
        for (String agentId : new LinkedHashSet<>(agentIds)) {
            if (repository.existsByConversationIdAndAgentId(conversationId, agentId)) continue;
            try {
                repository.insert(new AgentRegistrationDocument(conversationId, agentId));
                log.info("Registered agent {} for conversation {}", agentId, conversationId);
            } catch (DuplicateKeyException e) {
                log.debug("Agent {} already registered for conversation {}", agentId, conversationId);
            }
        }
    }

    @Override
    public void unregister(long conversationId, Collection<String> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) {
            long removed = repository.deleteByConversationId(conversationId);
            if (removed > 0) log.info("Unregistered {} agents for conversation {}", removed, conversationId);
            return;
        }
        for (String agentId : agentIds) {
            if (repository.deleteByConversationIdAndAgentId(conversationId, agentId) > 0) {
                log.info("Unregistered agent {} for conversation {}", agentId, conversationId);
            }
        }
    }

    @Override
    public List<RegisteredConversation> listRegistered() {
        Map<Long, List<String>> byConversation = new LinkedHashMap<>();
        for (AgentRegistrationDocument doc : repository.findAllByOrderByConversationIdAscRegisteredAtAsc()) {
            byConversation.computeIfAbsent(doc.getConversationId(), k -> new ArrayList<>()).add(doc.getAgentId());
        }
        List<RegisteredConversation> result = new ArrayList<>();
        byConversation.forEach((id, agents) -> result.add(new RegisteredConversation(id, agents)));
        return result;
    }

    @Override
    public List<String> listRegistered(long conversationId) {
        return repository.findByConversationIdOrderByRegisteredAtAsc(conversationId).stream()
                .map(AgentRegistrationDocument::getAgentId)
                .toList();
    }
}
