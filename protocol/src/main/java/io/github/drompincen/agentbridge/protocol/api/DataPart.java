package io.github.drompincen.agentbridge.protocol.api;

import java.util.Map;

public record DataPart(Map<String, Object> data) implements Part {

    public DataPart {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    @Override
    public String kind() {
        return "data";
    }
}
