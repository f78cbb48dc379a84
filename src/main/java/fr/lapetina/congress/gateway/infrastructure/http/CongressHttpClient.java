package fr.lapetina.congress.gateway.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP client for the Congress.gov v3 API.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every call is a GET on
 * {@code baseUrl + endpoint} with the credential and {@code format=json} appended to the query.
 * The credential never appears in logs or in exception messages.
 */
public class CongressHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CongressHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final UpstreamErrorClassifier classifier;

    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public CongressHttpClient(String baseUrl, String apiKey, Duration requestTimeout, Duration connectTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.classifier = new UpstreamErrorClassifier(objectMapper, apiKey);
    }

    /**
     * Fetches one upstream resource.
     *
     * @param endpoint path starting with {@code /}, relative to the base URL
     * @param params   query parameters; the credential and format are added here
     * @return the parsed JSON payload, or a future failed with {@link CongressApiException}
     */
    public CompletableFuture<JsonNode> get(String endpoint, Map<String, String> params) {
        URI uri;
        try {
            uri = buildUri(endpoint, params);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(CongressApiException.internal(
                    redact("Failed to build request URI for " + endpoint + ": " + e.getMessage()), e));
        }

        Instant startTime = Instant.now();
        log.info("Sending request: endpoint={}, uri={}", endpoint, redact(uri.toString()));

        return send(uri)
                .thenApply(response -> handleResponse(endpoint, response, startTime))
                .exceptionally(ex -> handleException(endpoint, ex));
    }

    /**
     * Performs the exchange. Tests override this to avoid the network.
     */
    protected CompletableFuture<UpstreamResponse> send(URI uri) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> new UpstreamResponse(response.statusCode(), response.body()));
    }

    URI buildUri(String endpoint, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>();
        if (params != null) {
            query.putAll(params);
        }
        query.put("api_key", apiKey);
        query.put("format", "json");

        StringJoiner joiner = new StringJoiner("&");
        query.forEach((key, value) -> joiner.add(encode(key) + "=" + encode(value == null ? "" : value)));

        return URI.create(baseUrl + endpoint + "?" + joiner);
    }

    private JsonNode handleResponse(String endpoint, UpstreamResponse response, Instant startTime) {
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();

        if (response.isSuccess()) {
            log.info("Request successful: endpoint={}, status={}, latencyMs={}",
                    endpoint, response.statusCode(), latencyMs);
            return parseSuccessResponse(endpoint, response.body());
        }

        CongressApiException error = classifier.classify(endpoint, response);
        log.warn("Request failed with HTTP error: endpoint={}, status={}, kind={}, latencyMs={}, error={}",
                endpoint, response.statusCode(), error.getKind(), latencyMs, error.getMessage());
        throw error;
    }

    private JsonNode parseSuccessResponse(String endpoint, String body) {
        try {
            JsonNode payload = objectMapper.readTree(body == null ? "" : body);
            if (payload == null || payload.isMissingNode()) {
                throw CongressApiException.internal(
                        "Failed to parse upstream response: empty body from " + endpoint, null);
            }
            return payload;
        } catch (CongressApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to parse response: endpoint={}, error={}", endpoint, e.getMessage());
            throw CongressApiException.internal(
                    redact("Failed to parse upstream response: " + e.getMessage()), e);
        }
    }

    private JsonNode handleException(String endpoint, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;

        // Already classified in handleResponse
        if (cause instanceof CongressApiException classified) {
            throw classified;
        }

        CongressApiException error = classifier.noResponse(cause);
        log.error("Upstream unreachable: endpoint={}, errorType={}, error={}",
                endpoint, cause.getClass().getSimpleName(), error.getMessage());
        throw error;
    }

    private String redact(String text) {
        return CongressApiException.redact(text, apiKey);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21
    }
}
