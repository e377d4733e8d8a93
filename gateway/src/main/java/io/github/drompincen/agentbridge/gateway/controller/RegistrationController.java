package io.github.drompincen.agentbridge.gateway.controller;

import io.github.drompincen.agentbridge.protocol.api.RegisteredConversation;
import io.github.drompincen.agentbridge.runtime.lifecycle.AgentLifecycleManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/registrations")
public class RegistrationController {

    private final AgentLifecycleManager lifecycleManager;

    public RegistrationController(AgentLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @GetMapping
    public List<RegisteredConversation> list() {
        return lifecycleManager.listRegistered();
    }
}
