package io.github.drompincen.agentbridge.gateway.controller;

import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.protocol.event.ConversationEventType;
import io.github.drompincen.agentbridge.runtime.event.ConversationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/conversations/{conversationId}/events")
public class ConversationEventController {

    private final ConversationEventPublisher publisher;

    public ConversationEventController(ConversationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @GetMapping
    public List<ConversationEvent> history(@PathVariable long conversationId) {
        return publisher.history(conversationId);
    }

    @PostMapping
    public ResponseEntity<ConversationEvent> publish(@PathVariable long conversationId,
                                                     @RequestBody Map<String, Object> body) {
        ConversationEventType type;
        Finality finality;
        try {
            type = body.get("type") == null ? ConversationEventType.MESSAGE
                    : ConversationEventType.fromWire(String.valueOf(body.get("type")));
            finality = body.get("finality") == null ? Finality.NONE
                    : Finality.fromWire(String.valueOf(body.get("finality")));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
        Object agentId = body.get("agentId");
        ConversationEvent event = publisher.publish(conversationId, type, finality,
                agentId == null ? null : String.valueOf(agentId), body.get("payload"));
        return ResponseEntity.ok(event);
    }
}
