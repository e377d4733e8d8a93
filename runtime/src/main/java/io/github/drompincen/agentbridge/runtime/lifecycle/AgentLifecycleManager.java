package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.protocol.api.RegisteredConversation;
import io.github.drompincen.agentbridge.protocol.api.RuntimeAgentInfo;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.protocol.event.ConversationEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Composes the durable registry with the process-local host. The registry always changes first:
 * intent is recorded before workers start and withdrawn before workers stop, so a crash in between
 * is repaired by {@link #resumeAll()}. Operations on one conversation are serialised, so a resume
 * never restarts workers whose registrations a concurrent stop has just withdrawn.
 */
@Service
public class AgentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycleManager.class);

    private final AgentRegistry registry;
    private final AgentHost host;
    private final ConcurrentHashMap<Long, Object> conversationLocks = new ConcurrentHashMap<>();

    private ConversationEventSource eventSource;
    private String subscriptionId;

    public AgentLifecycleManager(AgentRegistry registry, AgentHost host) {
        this.registry = registry;
        this.host = host;
    }

    private Object lockFor(long conversationId) {
        return conversationLocks.computeIfAbsent(conversationId, k -> new Object());
    }

    public List<RuntimeAgentInfo> ensure(long conversationId, Collection<String> agentIds) {
        synchronized (lockFor(conversationId)) {
            registry.register(conversationId, agentIds);
            host.ensure(conversationId, agentIds);
            return host.list(conversationId);
        }
    }

    public void stop(long conversationId) {
        stop(conversationId, null);
    }

    /**
     * Stops the given agents, or all of them when {@code agentIds} is null or empty. A partial stop
     * restarts the agents that stay registered.
     */
    public void stop(long conversationId, Collection<String> agentIds) {
        synchronized (lockFor(conversationId)) {
            registry.unregister(conversationId, agentIds);
            host.stop(conversationId);
            if (agentIds == null || agentIds.isEmpty()) return;
            List<String> remaining = registry.listRegistered(conversationId);
            if (!remaining.isEmpty()) {
                host.ensure(conversationId, remaining);
            }
        }
    }

    /**
     * Starts the workers of every registered conversation. Every conversation is attempted; if any
     * failed, a {@link LifecycleException} carrying each failure as suppressed is thrown afterwards.
     */
    public void resumeAll() {
        List<RegisteredConversation> registered = registry.listRegistered();
        List<RuntimeException> failures = new ArrayList<>();
        for (RegisteredConversation conversation : registered) {
            try {
                resume(conversation.conversationId());
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            LifecycleException error = new LifecycleException(
                    "Failed to resume " + failures.size() + " of " + registered.size() + " conversations",
                    failures.get(0));
            failures.stream().skip(1).forEach(error::addSuppressed);
            throw error;
        }
        log.debug("Resumed {} registered conversations", registered.size());
    }

    /** Best-effort {@link #resumeAll()} for periodic repair: failures are logged and retried next round. */
    public void reconcile() {
        List<RegisteredConversation> registered = registry.listRegistered();
        for (RegisteredConversation conversation : registered) {
            try {
                resume(conversation.conversationId());
            } catch (RuntimeException e) {
                log.error("Failed to reconcile agents for conversation {}", conversation.conversationId(), e);
            }
        }
        log.debug("Reconciled {} registered conversations", registered.size());
    }

    private void resume(long conversationId) {
        synchronized (lockFor(conversationId)) {
            // the snapshot may be stale by now
            List<String> agentIds = registry.listRegistered(conversationId);
            if (!agentIds.isEmpty()) {
                host.ensure(conversationId, agentIds);
            }
        }
    }

    public void clearOthers(long keepConversationId) {
        for (RegisteredConversation conversation : registry.listRegistered()) {
            long id = conversation.conversationId();
            if (id == keepConversationId) continue;
            try {
                stop(id);
                log.info("Cleared agents for conversation {}", id);
            } catch (RuntimeException e) {
                log.error("Failed to clear agents for conversation {}", id, e);
            }
        }
    }

    public List<RuntimeAgentInfo> listRuntime(long conversationId) {
        return host.list(conversationId);
    }

    public List<RegisteredConversation> listRegistered() {
        return registry.listRegistered();
    }

    /** Stops a conversation's agents once a message closes the conversation. */
    public synchronized void initialize(ConversationEventSource source) {
        if (subscriptionId != null) return;
        try {
            subscriptionId = source.subscribeAll(this::onEvent);
            eventSource = source;
            log.info("Auto-shutdown subscribed to conversation events");
        } catch (RuntimeException e) {
            log.error("Failed to subscribe to conversation events", e);
        }
    }

    public synchronized void shutdown() {
        if (subscriptionId == null) return;
        try {
            eventSource.unsubscribe(subscriptionId);
        } catch (RuntimeException e) {
            log.warn("Failed to unsubscribe from conversation events", e);
        } finally {
            subscriptionId = null;
            eventSource = null;
        }
    }

    void onEvent(ConversationEvent event) {
        if (event.type() != ConversationEventType.MESSAGE || !event.endsConversation()) return;
        try {
            log.info("Conversation {} ended, stopping its agents", event.conversation());
            stop(event.conversation());
        } catch (RuntimeException e) {
            log.error("Auto-shutdown failed for conversation {}", event.conversation(), e);
        }
    }
}
