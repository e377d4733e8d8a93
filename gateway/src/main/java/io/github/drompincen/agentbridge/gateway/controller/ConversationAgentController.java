package io.github.drompincen.agentbridge.gateway.controller;

import io.github.drompincen.agentbridge.protocol.api.EnsureAgentsRequest;
import io.github.drompincen.agentbridge.protocol.api.RuntimeAgentInfo;
import io.github.drompincen.agentbridge.runtime.lifecycle.AgentLifecycleManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/conversations/{conversationId}/agents")
public class ConversationAgentController {

    private final AgentLifecycleManager lifecycleManager;

    public ConversationAgentController(AgentLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @GetMapping
    public List<RuntimeAgentInfo> list(@PathVariable long conversationId) {
        return lifecycleManager.listRuntime(conversationId);
    }

    @PostMapping
    public ResponseEntity<List<RuntimeAgentInfo>> ensure(@PathVariable long conversationId,
                                                         @RequestBody EnsureAgentsRequest request) {
        if (request == null || request.agentIds() == null || request.agentIds().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(lifecycleManager.ensure(conversationId, request.agentIds()));
    }

    @DeleteMapping
    public ResponseEntity<Void> stop(@PathVariable long conversationId,
                                     @RequestParam(required = false) List<String> agentIds) {
        lifecycleManager.stop(conversationId, agentIds);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/clear-others")
    public ResponseEntity<Void> clearOthers(@PathVariable long conversationId) {
        lifecycleManager.clearOthers(conversationId);
        return ResponseEntity.noContent().build();
    }
}
