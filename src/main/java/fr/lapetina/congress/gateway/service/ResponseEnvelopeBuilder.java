package fr.lapetina.congress.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.ResourceContents;
import fr.lapetina.congress.gateway.domain.model.ResponseEnvelope;

/**
 * Wraps a payload in the uniform {@code {contents: [{uri, mimeType, text}]}} structure.
 * Deterministic: the same identifier and payload always give the same text.
 */
public class ResponseEnvelopeBuilder {

    private final ObjectWriter writer;

    public ResponseEnvelopeBuilder(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public ResourceContents wrap(String identifier, Object payload) {
        try {
            return ResourceContents.of(ResponseEnvelope.json(identifier, writer.writeValueAsString(payload)));
        } catch (JsonProcessingException e) {
            throw CongressApiException.internal("Failed to serialize response for " + identifier, e);
        }
    }
}
