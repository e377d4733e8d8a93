package io.github.drompincen.agentbridge.runtime.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder worker used when no {@link AgentWorkerFactory} is supplied: holds its slot until stopped.
 */
public class IdleAgentWorker implements AgentWorker {

    private static final Logger log = LoggerFactory.getLogger(IdleAgentWorker.class);
    private static final long PARK_MILLIS = 250;

    public static AgentWorkerFactory factory() {
        return (conversationId, agentId) -> new IdleAgentWorker();
    }

    @Override
    public void run(AgentWorkerContext context) throws InterruptedException {
        log.debug("Idle agent {} parked on conversation {}", context.agentId(), context.conversationId());
        while (!context.isStopRequested()) {
            Thread.sleep(PARK_MILLIS);
        }
    }
}
