package io.github.drompincen.agentbridge.protocol.api;

import java.util.Objects;

public record FilePart(FileContent file) implements Part {

    public FilePart {
        Objects.requireNonNull(file, "file");
    }

    @Override
    public String kind() {
        return "file";
    }
}
