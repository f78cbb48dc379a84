package fr.lapetina.congress.gateway.domain.model;

import java.util.Objects;

/**
 * Uniform success wrapper: the originating identifier, a constant media type and the
 * serialized JSON payload.
 */
public record ResponseEnvelope(String uri, String mimeType, String text) {

    public static final String JSON_MIME_TYPE = "application/json";

    public ResponseEnvelope {
        Objects.requireNonNull(uri, "URI is required");
        Objects.requireNonNull(text, "Text is required");
        if (mimeType == null) {
            mimeType = JSON_MIME_TYPE;
        }
    }

    public static ResponseEnvelope json(String uri, String text) {
        return new ResponseEnvelope(uri, JSON_MIME_TYPE, text);
    }
}
