package fr.lapetina.congress.gateway.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;

import java.util.Locale;

/**
 * Maps a failed upstream exchange to a {@link CongressApiException}.
 *
 * Status rules, first match wins:
 * - 404 is NOT_FOUND
 * - 500 whose message mentions "not found" is NOT_FOUND (the upstream reports some missing
 *   records this way)
 * - 429 is RATE_LIMIT_EXCEEDED
 * - anything else is UPSTREAM_API_ERROR carrying the status and the body, parsed when it is
 *   JSON and as raw text otherwise
 *
 * Every message and body is scrubbed of the credential.
 */
public final class UpstreamErrorClassifier {

    private final ObjectMapper objectMapper;
    private final String credential;

    public UpstreamErrorClassifier(ObjectMapper objectMapper, String credential) {
        this.objectMapper = objectMapper;
        this.credential = credential;
    }

    public CongressApiException classify(String endpoint, UpstreamResponse response) {
        int status = response.statusCode();
        String rawBody = redact(response.body());
        JsonNode body = parseQuietly(rawBody);
        String message = extractMessage(body, status);

        if (status == 404) {
            return CongressApiException.notFound("Resource not found at API endpoint: " + endpoint);
        }
        if (status == 500 && message.toLowerCase(Locale.ROOT).contains("not found")) {
            return CongressApiException.notFound(
                    "Resource not found at API endpoint (reported as 500): " + endpoint);
        }
        if (status == 429) {
            return CongressApiException.rateLimitExceeded("Congress.gov API rate limit hit (status 429)", 429);
        }
        return CongressApiException.upstream(
                redact("Congress API request failed with status " + status + ": " + message),
                status,
                details(body, rawBody));
    }

    /**
     * No HTTP response at all: connect failure, timeout, reset.
     */
    public CongressApiException noResponse(Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return CongressApiException.noResponse(
                redact("Congress API request failed: No response received. " + detail), cause);
    }

    /**
     * Upstream message from {@code message}, then {@code error.message}, then {@code error}
     * as a string, then {@code HTTP {status}}.
     */
    String extractMessage(JsonNode body, int status) {
        if (body != null && body.isObject()) {
            JsonNode message = body.get("message");
            if (message != null && message.isTextual()) {
                return message.asText();
            }
            JsonNode error = body.get("error");
            if (error != null) {
                JsonNode nested = error.get("message");
                if (nested != null && nested.isTextual()) {
                    return nested.asText();
                }
                if (error.isTextual()) {
                    return error.asText();
                }
            }
        }
        return "HTTP " + status;
    }

    private static JsonNode details(JsonNode parsed, String rawBody) {
        if (parsed != null) {
            return parsed;
        }
        return rawBody == null || rawBody.isBlank() ? null : TextNode.valueOf(rawBody);
    }

    private JsonNode parseQuietly(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            // Error bodies are not always JSON
            return null;
        }
    }

    private String redact(String text) {
        return CongressApiException.redact(text, credential);
    }
}
