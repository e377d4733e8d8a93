package io.github.drompincen.agentbridge.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentbridge.runtime.lifecycle.AgentHost;
import io.github.drompincen.agentbridge.runtime.lifecycle.AgentRegistry;
import io.github.drompincen.agentbridge.runtime.lifecycle.AgentWorkerFactory;
import io.github.drompincen.agentbridge.runtime.lifecycle.IdleAgentWorker;
import io.github.drompincen.agentbridge.runtime.lifecycle.InProcessAgentHost;
import io.github.drompincen.agentbridge.runtime.transport.TransportAdapterFactory;
import io.github.drompincen.agentbridge.runtime.transport.task.TaskProtocolClientFactory;
import io.github.drompincen.agentbridge.runtime.transport.toolcall.ToolCallProtocolClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Outermost wiring point: adapter defaults and the worker factory are chosen here and nowhere else.
 */
@Configuration
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeConfig {

    private static final Logger log = LoggerFactory.getLogger(BridgeConfig.class);

    @Bean
    AgentHost agentHost(ObjectProvider<AgentWorkerFactory> workerFactories, AgentRegistry registry,
                        BridgeProperties properties) {
        AgentWorkerFactory factory = workerFactories.getIfAvailable(() -> {
            log.info("No AgentWorkerFactory bean, agents will run as idle placeholders");
            return IdleAgentWorker.factory();
        });
        return new InProcessAgentHost(factory, registry, Duration.ofMillis(properties.getHost().getStopGraceMs()));
    }

    @Bean
    TransportAdapterFactory transportAdapterFactory(BridgeProperties properties,
                                                    ObjectProvider<TaskProtocolClientFactory> taskClients,
                                                    ObjectProvider<ToolCallProtocolClientFactory> toolCallClients,
                                                    ObjectMapper objectMapper) {
        return new TransportAdapterFactory(properties.toTransportSettings(),
                taskClients.getIfAvailable(), toolCallClients.getIfAvailable(),
                Schedulers.boundedElastic(), objectMapper);
    }
}
