package io.github.drompincen.agentbridge.runtime.lifecycle;

import io.github.drompincen.agentbridge.protocol.api.RuntimeAgentInfo;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs each agent worker on its own daemon thread. Workers of one conversation are started and
 * stopped under a per-conversation lock.
 */
public class InProcessAgentHost implements AgentHost {

    private static final Logger log = LoggerFactory.getLogger(InProcessAgentHost.class);

    private final AgentWorkerFactory workerFactory;
    private final AgentRegistry registry;
    private final Duration stopGrace;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-worker");
        t.setDaemon(true);
        return t;
    });
    private final ConcurrentHashMap<Long, Map<String, WorkerHandle>> running = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Object> locks = new ConcurrentHashMap<>();

    public InProcessAgentHost(AgentWorkerFactory workerFactory, AgentRegistry registry, Duration stopGrace) {
        this.workerFactory = workerFactory;
        this.registry = registry;
        this.stopGrace = stopGrace;
    }

    @Override
    public void ensure(long conversationId, Collection<String> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) return;
        synchronized (lockFor(conversationId)) {
            Map<String, WorkerHandle> workers = running.computeIfAbsent(conversationId, k -> new LinkedHashMap<>());
            workers.values().removeIf(WorkerHandle::isDone);
            for (String agentId : new LinkedHashSet<>(agentIds)) {
                if (workers.containsKey(agentId)) continue;
                AgentWorker worker;
                try {
                    worker = workerFactory.create(conversationId, agentId);
                } catch (RuntimeException e) {
                    throw new LifecycleException("Cannot create agent " + agentId
                            + " for conversation " + conversationId, e);
                }
                workers.put(agentId, start(conversationId, agentId, worker));
                log.info("Started agent {} for conversation {}", agentId, conversationId);
            }
        }
    }

    @Override
    public void stop(long conversationId) {
        synchronized (lockFor(conversationId)) {
            Map<String, WorkerHandle> workers = running.remove(conversationId);
            if (workers == null || workers.isEmpty()) return;
            workers.values().forEach(WorkerHandle::requestStop);
            long deadline = System.nanoTime() + stopGrace.toNanos();
            for (Map.Entry<String, WorkerHandle> entry : workers.entrySet()) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                try {
                    if (!entry.getValue().finished.await(remaining, TimeUnit.NANOSECONDS)) {
                        log.warn("Agent {} of conversation {} did not stop within {}",
                                entry.getKey(), conversationId, stopGrace);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LifecycleException("Interrupted while stopping conversation " + conversationId, e);
                }
            }
            log.info("Stopped {} agents for conversation {}", workers.size(), conversationId);
        }
    }

    @Override
    public List<RuntimeAgentInfo> list(long conversationId) {
        List<RuntimeAgentInfo> result = new ArrayList<>();
        synchronized (lockFor(conversationId)) {
            Map<String, WorkerHandle> workers = running.get(conversationId);
            if (workers != null) {
                workers.forEach((agentId, handle) -> {
                    if (!handle.isDone()) {
                        result.add(new RuntimeAgentInfo(agentId, handle.workerClass, handle.startedAt));
                    }
                });
            }
        }
        if (result.isEmpty()) {
            // startup resume may still be in flight
            return registry.listRegistered(conversationId).stream()
                    .map(RuntimeAgentInfo::intended)
                    .toList();
        }
        return result;
    }

    @Override
    @PreDestroy
    public void stopAll() {
        for (Long conversationId : new ArrayList<>(running.keySet())) {
            try {
                stop(conversationId);
            } catch (RuntimeException e) {
                log.error("Failed to stop agents for conversation {}", conversationId, e);
            }
        }
        executor.shutdownNow();
    }

    int runningCount(long conversationId) {
        Map<String, WorkerHandle> workers = running.get(conversationId);
        if (workers == null) return 0;
        synchronized (lockFor(conversationId)) {
            return (int) workers.values().stream().filter(h -> !h.isDone()).count();
        }
    }

    private Object lockFor(long conversationId) {
        return locks.computeIfAbsent(conversationId, k -> new Object());
    }

    private WorkerHandle start(long conversationId, String agentId, AgentWorker worker) {
        WorkerHandle handle = new WorkerHandle(worker.getClass().getName(), Instant.now());
        AgentWorkerContext context = new AgentWorkerContext(conversationId, agentId, handle.stopRequested::get);
        handle.future = executor.submit(() -> {
            if (!handle.claimed.compareAndSet(false, true)) return;
            try {
                worker.run(context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.error("Agent {} of conversation {} failed", agentId, conversationId, e);
            } finally {
                handle.finished.countDown();
            }
        });
        return handle;
    }

    private static final class WorkerHandle {
        final String workerClass;
        final Instant startedAt;
        final AtomicBoolean stopRequested = new AtomicBoolean();
        final AtomicBoolean claimed = new AtomicBoolean();
        final CountDownLatch finished = new CountDownLatch(1);
        volatile Future<?> future;

        WorkerHandle(String workerClass, Instant startedAt) {
            this.workerClass = workerClass;
            this.startedAt = startedAt;
        }

        boolean isDone() {
            return finished.getCount() == 0;
        }

        void requestStop() {
            stopRequested.set(true);
            if (claimed.compareAndSet(false, true)) {
                // never got a thread
                finished.countDown();
            }
            Future<?> f = future;
            if (f != null) f.cancel(true);
        }
    }
}
