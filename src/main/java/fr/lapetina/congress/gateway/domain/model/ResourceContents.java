package fr.lapetina.congress.gateway.domain.model;

import java.util.List;

/**
 * The {@code {contents: [...]}} structure handed to the transport.
 */
public record ResourceContents(List<ResponseEnvelope> contents) {

    public ResourceContents {
        contents = contents != null ? List.copyOf(contents) : List.of();
    }

    public static ResourceContents of(ResponseEnvelope envelope) {
        return new ResourceContents(List.of(envelope));
    }

    /**
     * The first (and in practice only) envelope.
     */
    public ResponseEnvelope first() {
        if (contents.isEmpty()) {
            throw new IllegalStateException("No contents");
        }
        return contents.get(0);
    }
}
