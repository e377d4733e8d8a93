package io.github.drompincen.agentbridge.persistence.document;

import io.github.drompincen.agentbridge.protocol.api.Finality;
import io.github.drompincen.agentbridge.protocol.event.ConversationEvent;
import io.github.drompincen.agentbridge.protocol.event.ConversationEventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationEventDocumentTest {

    @Test
    void toEventCopiesAllFields() {
        Instant now = Instant.now();
        ConversationEventDocument doc = new ConversationEventDocument();
        doc.setEventId("e1");
        doc.setConversationId(42L);
        doc.setSeq(3);
        doc.setType(ConversationEventType.MESSAGE);
        doc.setFinality(Finality.CONVERSATION);
        doc.setAgentId("planner");
        doc.setTimestamp(now);

        ConversationEvent event = doc.toEvent();

        assertThat(event.eventId()).isEqualTo("e1");
        assertThat(event.conversation()).isEqualTo(42L);
        assertThat(event.seq()).isEqualTo(3);
        assertThat(event.agentId()).isEqualTo("planner");
        assertThat(event.timestamp()).isEqualTo(now);
        assertThat(event.endsConversation()).isTrue();
    }
}
