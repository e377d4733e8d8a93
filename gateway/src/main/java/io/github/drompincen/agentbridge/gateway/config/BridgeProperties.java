package io.github.drompincen.agentbridge.gateway.config;

import io.github.drompincen.agentbridge.runtime.transport.EndpointConfig;
import io.github.drompincen.agentbridge.runtime.transport.TransportSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("agentbridge")
public class BridgeProperties {

    private Endpoint task = new Endpoint();
    private Endpoint toolCall = new Endpoint();
    private long checkRepliesWaitMs = 10_000;
    private long pollBackoffMs = 800;
    private Host host = new Host();
    private Lifecycle lifecycle = new Lifecycle();

    public TransportSettings toTransportSettings() {
        return new TransportSettings(task.toConfig(), toolCall.toConfig(),
                Duration.ofMillis(checkRepliesWaitMs), Duration.ofMillis(pollBackoffMs));
    }

    public Endpoint getTask() { return task; }
    public void setTask(Endpoint task) { this.task = task; }

    public Endpoint getToolCall() { return toolCall; }
    public void setToolCall(Endpoint toolCall) { this.toolCall = toolCall; }

    public long getCheckRepliesWaitMs() { return checkRepliesWaitMs; }
    public void setCheckRepliesWaitMs(long checkRepliesWaitMs) { this.checkRepliesWaitMs = checkRepliesWaitMs; }

    public long getPollBackoffMs() { return pollBackoffMs; }
    public void setPollBackoffMs(long pollBackoffMs) { this.pollBackoffMs = pollBackoffMs; }

    public Host getHost() { return host; }
    public void setHost(Host host) { this.host = host; }

    public Lifecycle getLifecycle() { return lifecycle; }
    public void setLifecycle(Lifecycle lifecycle) { this.lifecycle = lifecycle; }

    public static class Endpoint {
        private String endpoint;
        private String defaultModel;

        EndpointConfig toConfig() {
            return new EndpointConfig(endpoint, defaultModel);
        }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
    }

    public static class Host {
        private long stopGraceMs = 5_000;

        public long getStopGraceMs() { return stopGraceMs; }
        public void setStopGraceMs(long stopGraceMs) { this.stopGraceMs = stopGraceMs; }
    }

    public static class Lifecycle {
        private boolean resumeOnStartup = true;
        private long reconcileIntervalMs = 30_000;

        public boolean isResumeOnStartup() { return resumeOnStartup; }
        public void setResumeOnStartup(boolean resumeOnStartup) { this.resumeOnStartup = resumeOnStartup; }

        public long getReconcileIntervalMs() { return reconcileIntervalMs; }
        public void setReconcileIntervalMs(long reconcileIntervalMs) { this.reconcileIntervalMs = reconcileIntervalMs; }
    }
}
