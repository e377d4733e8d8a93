package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.protocol.api.RuntimeAgentInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InProcessAgentHostTest {

    @Mock private AgentRegistry registry;

    private final AtomicInteger created = new AtomicInteger();
    private final ConcurrentHashMap<String, CountDownLatch> startedLatches = new ConcurrentHashMap<>();
    private InProcessAgentHost host;

    /** Parks until asked to stop. */
    private AgentWorker parkedWorker(String agentId) {
        CountDownLatch started = startedLatches.computeIfAbsent(agentId, k -> new CountDownLatch(1));
        return context -> {
            started.countDown();
            while (!context.isStopRequested()) {
                Thread.sleep(10);
            }
        };
    }

    @BeforeEach
    void setUp() {
        host = new InProcessAgentHost((conversationId, agentId) -> {
            created.incrementAndGet();
            return parkedWorker(agentId);
        }, registry, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        host.stopAll();
    }

    private void awaitStarted(String agentId) throws InterruptedException {
        assertThat(startedLatches.get(agentId).await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void ensureStartsOnlyMissingWorkers() throws InterruptedException {
        host.ensure(42L, List.of("a"));
        host.ensure(42L, List.of("a", "b"));
        awaitStarted("a");
        awaitStarted("b");

        assertThat(created.get()).isEqualTo(2);
        assertThat(host.list(42L)).extracting(RuntimeAgentInfo::agentId).containsExactly("a", "b");
        assertThat(host.list(42L)).allSatisfy(info -> {
            assertThat(info.startedAt()).isNotNull();
            assertThat(info.workerClass()).isNotNull();
        });
    }

    @Test
    void stopStopsEveryWorkerOfConversation() throws InterruptedException {
        host.ensure(42L, List.of("a", "b"));
        host.ensure(7L, List.of("c"));
        awaitStarted("a");
        awaitStarted("b");

        host.stop(42L);

        assertThat(host.runningCount(42L)).isZero();
        assertThat(host.runningCount(7L)).isEqualTo(1);
    }

    @Test
    void stopOfUnknownConversationIsNoOp() {
        host.stop(99L);

        assertThat(host.runningCount(99L)).isZero();
    }

    @Test
    void finishedWorkerIsRestartedByEnsure() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(2);
        InProcessAgentHost oneShot = new InProcessAgentHost((c, a) -> context -> ran.countDown(),
                registry, Duration.ofSeconds(1));
        try {
            oneShot.ensure(1L, List.of("a"));
            Thread.sleep(100);
            oneShot.ensure(1L, List.of("a"));

            assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            oneShot.stopAll();
        }
    }

    @Test
    void crashingWorkerDoesNotAffectOthers() throws InterruptedException {
        AgentWorker crashing = context -> {
            throw new IllegalStateException("boom");
        };
        InProcessAgentHost mixed = new InProcessAgentHost(
                (c, agentId) -> "bad".equals(agentId) ? crashing : parkedWorker(agentId),
                registry, Duration.ofSeconds(1));
        try {
            mixed.ensure(5L, List.of("bad", "good"));
            awaitStarted("good");
            Thread.sleep(100);

            assertThat(mixed.list(5L)).extracting(RuntimeAgentInfo::agentId).containsExactly("good");
        } finally {
            mixed.stopAll();
        }
    }

    @Test
    void factoryFailureIsWrapped() {
        InProcessAgentHost failing = new InProcessAgentHost((c, a) -> {
            throw new IllegalArgumentException("unknown agent " + a);
        }, registry, Duration.ofSeconds(1));

        assertThatThrownBy(() -> failing.ensure(1L, List.of("ghost")))
                .isInstanceOf(LifecycleException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        failing.stopAll();
    }

    @Test
    void listFallsBackToRegisteredIdsWhileNothingRuns() {
        when(registry.listRegistered(42L)).thenReturn(List.of("a", "b"));

        List<RuntimeAgentInfo> listing = host.list(42L);

        assertThat(listing).containsExactly(RuntimeAgentInfo.intended("a"), RuntimeAgentInfo.intended("b"));
    }

    @Test
    void stopAllStopsEverything() throws InterruptedException {
        host.ensure(1L, List.of("a"));
        host.ensure(2L, List.of("b"));
        awaitStarted("a");
        awaitStarted("b");

        host.stopAll();

        assertThat(host.runningCount(1L)).isZero();
        assertThat(host.runningCount(2L)).isZero();
    }
}
