package io.github.drompincen.agentbridge.gateway.lifecycle;

import io.github.drompincen.agentbridge.gateway.config.BridgeProperties;
import io.github.drompincen.agentbridge.runtime.lifecycle.AgentLifecycleManager;
import io.github.drompincen.agentbridge.runtime.lifecycle.ConversationEventSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Starts auto-shutdown and restores registered agents once the application is ready, then keeps
 * the host converged on the registry.
 */
@Service
public class LifecycleBootstrapService {

    private static final Logger log = LoggerFactory.getLogger(LifecycleBootstrapService.class);

    private final AgentLifecycleManager lifecycleManager;
    private final ConversationEventSource eventSource;
    private final BridgeProperties properties;
    private volatile boolean ready = false;

    public LifecycleBootstrapService(AgentLifecycleManager lifecycleManager, ConversationEventSource eventSource,
                                     BridgeProperties properties) {
        this.lifecycleManager = lifecycleManager;
        this.eventSource = eventSource;
        this.properties = properties;
    }

    /** A failed startup resume propagates and aborts the application start. */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        lifecycleManager.initialize(eventSource);
        if (properties.getLifecycle().isResumeOnStartup()) {
            log.info("Resuming registered agents");
            lifecycleManager.resumeAll();
        }
        ready = true;
    }

    /** Restarts workers that finished or crashed while still registered. */
    @Scheduled(fixedDelayString = "${agentbridge.lifecycle.reconcile-interval-ms:30000}",
            initialDelayString = "${agentbridge.lifecycle.reconcile-interval-ms:30000}")
    public void reconcile() {
        if (!ready) return;
        lifecycleManager.reconcile();
    }

    @PreDestroy
    public void shutdown() {
        ready = false;
        lifecycleManager.shutdown();
    }
}
