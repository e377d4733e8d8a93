package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.protocol.api.RegisteredConversation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs a resume against a real host while a stop withdraws the same conversation.
 */
class AgentLifecycleConcurrencyTest {

    /** In-memory registry whose conversation listing can be held open. */
    static class PausingRegistry implements AgentRegistry {
        private final Map<Long, Set<String>> rows = new TreeMap<>();
        volatile CountDownLatch listed;
        volatile CountDownLatch release;

        @Override
        public synchronized void register(long conversationId, Collection<String> agentIds) {
            rows.computeIfAbsent(conversationId, k -> new LinkedHashSet<>()).addAll(agentIds);
        }

        @Override
        public synchronized void unregister(long conversationId, Collection<String> agentIds) {
            if (agentIds == null || agentIds.isEmpty()) {
                rows.remove(conversationId);
                return;
            }
            Set<String> ids = rows.get(conversationId);
            if (ids == null) return;
            ids.removeAll(agentIds);
            if (ids.isEmpty()) rows.remove(conversationId);
        }

        @Override
        public List<RegisteredConversation> listRegistered() {
            List<RegisteredConversation> snapshot = new ArrayList<>();
            synchronized (this) {
                rows.forEach((id, ids) -> snapshot.add(new RegisteredConversation(id, List.copyOf(ids))));
            }
            CountDownLatch hold = release;
            if (hold != null) {
                listed.countDown();
                try {
                    hold.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return snapshot;
        }

        @Override
        public synchronized List<String> listRegistered(long conversationId) {
            Set<String> ids = rows.get(conversationId);
            return ids == null ? List.of() : List.copyOf(ids);
        }
    }

    private final ExecutorService background = Executors.newSingleThreadExecutor();
    private PausingRegistry registry;
    private InProcessAgentHost host;
    private AgentLifecycleManager manager;

    @BeforeEach
    void setUp() {
        registry = new PausingRegistry();
        host = new InProcessAgentHost((conversationId, agentId) -> context -> {
            while (!context.isStopRequested()) {
                Thread.sleep(10);
            }
        }, registry, Duration.ofSeconds(2));
        manager = new AgentLifecycleManager(registry, host);
    }

    @AfterEach
    void tearDown() {
        background.shutdownNow();
        host.stopAll();
    }

    private Future<?> resumeHeldAfterListing(Runnable resume) throws InterruptedException {
        registry.listed = new CountDownLatch(1);
        registry.release = new CountDownLatch(1);
        Future<?> pending = background.submit(resume);
        assertThat(registry.listed.await(2, TimeUnit.SECONDS)).isTrue();
        return pending;
    }

    @Test
    void stopDuringResumeLeavesNothingRunning() throws Exception {
        manager.ensure(42L, List.of("a", "b"));
        assertThat(host.runningCount(42L)).isEqualTo(2);

        Future<?> resume = resumeHeldAfterListing(manager::resumeAll);
        manager.stop(42L);
        registry.release.countDown();
        resume.get(5, TimeUnit.SECONDS);

        assertThat(registry.listRegistered(42L)).isEmpty();
        assertThat(host.runningCount(42L)).isZero();
    }

    @Test
    void stopDuringReconcileLeavesNothingRunning() throws Exception {
        manager.ensure(42L, List.of("a"));
        manager.ensure(7L, List.of("c"));

        Future<?> reconcile = resumeHeldAfterListing(manager::reconcile);
        manager.stop(42L);
        registry.release.countDown();
        reconcile.get(5, TimeUnit.SECONDS);

        assertThat(host.runningCount(42L)).isZero();
        assertThat(host.runningCount(7L)).isEqualTo(1);
    }

    @Test
    void partialStopDuringResumeKeepsOnlyRemainingAgent() throws Exception {
        manager.ensure(42L, List.of("a", "b"));

        Future<?> resume = resumeHeldAfterListing(manager::resumeAll);
        manager.stop(42L, List.of("a"));
        registry.release.countDown();
        resume.get(5, TimeUnit.SECONDS);

        assertThat(host.runningCount(42L)).isEqualTo(1);
        assertThat(host.list(42L)).extracting(info -> info.agentId()).containsExactly("b");
    }
}
