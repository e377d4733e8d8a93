package io.github.drompincen.agentbridge.runtime.transport;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cooperative cancellation signal shared by a tick consumer and the stream it reads.
 */
public final class CancelToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> signal = Sinks.one();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Emits once when {@link #cancel()} is called; replays to late subscribers. */
    public Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }
}
