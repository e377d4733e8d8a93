package io.github.drompincen.agentbridge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.agentbridge")
@EnableMongoRepositories(basePackages = "io.github.drompincen.agentbridge.persistence.repository")
@EnableScheduling
public class AgentBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentBridgeApplication.class, args);
    }
}
