package io.github.drompincen.agentbridge.runtime.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentbridge.protocol.api.TransportKind;
import io.github.drompincen.agentbridge.runtime.transport.task.TaskProtocolClient;
import io.github.drompincen.agentbridge.runtime.transport.task.TaskProtocolClientFactory;
import io.github.drompincen.agentbridge.runtime.transport.task.TaskTransportAdapter;
import io.github.drompincen.agentbridge.runtime.transport.toolcall.ToolCallProtocolClient;
import io.github.drompincen.agentbridge.runtime.transport.toolcall.ToolCallProtocolClientFactory;
import io.github.drompincen.agentbridge.runtime.transport.toolcall.ToolCallTransportAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransportAdapterFactoryTest {

    private static final TransportSettings SETTINGS = new TransportSettings(
            new EndpointConfig("http://task.local/a2a", "model-a"),
            new EndpointConfig("http://tools.local/mcp", "model-m"),
            Duration.ofSeconds(10), Duration.ofMillis(800));

    @Mock private TaskProtocolClientFactory taskClients;
    @Mock private ToolCallProtocolClientFactory toolCallClients;
    @Mock private TaskProtocolClient taskClient;
    @Mock private ToolCallProtocolClient toolCallClient;

    private TransportAdapterFactory factory() {
        return new TransportAdapterFactory(SETTINGS, taskClients, toolCallClients,
                Schedulers.boundedElastic(), new ObjectMapper());
    }

    @Test
    void taskKindUsesConfiguredEndpoint() {
        when(taskClients.create(SETTINGS.task())).thenReturn(taskClient);

        TransportAdapter adapter = factory().create(TransportKind.TASK);

        assertThat(adapter).isInstanceOf(TaskTransportAdapter.class);
        assertThat(adapter.kind()).isEqualTo(TransportKind.TASK);
    }

    @Test
    void overrideReplacesEndpointButKeepsModel() {
        EndpointConfig expected = new EndpointConfig("http://other.local/mcp", "model-m");
        when(toolCallClients.create(expected)).thenReturn(toolCallClient);

        TransportAdapter adapter = factory().create(TransportKind.TOOL_CALL, "http://other.local/mcp");

        assertThat(adapter).isInstanceOf(ToolCallTransportAdapter.class);
        verify(toolCallClients).create(expected);
    }

    @Test
    void missingClientFactoryIsReported() {
        TransportAdapterFactory factory = new TransportAdapterFactory(SETTINGS, null, null,
                Schedulers.boundedElastic(), new ObjectMapper());

        assertThatThrownBy(() -> factory.create(TransportKind.TASK)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> factory.create(TransportKind.TOOL_CALL)).isInstanceOf(IllegalStateException.class);
    }
}
