package fr.lapetina.congress.gateway.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class CongressHttpClientTest {

    private static final String KEY = "abc123secret";

    private RecordingClient client;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
    }

    @Test
    @DisplayName("should append the credential and json format to every request")
    void shouldAppendCredentialAndFormat() throws Exception {
        client.respondWith(new UpstreamResponse(200, "{\"bill\":{\"number\":\"1\"}}"));
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", "5");

        JsonNode payload = client.get("/bill/118/hr/1", params).get(1, TimeUnit.SECONDS);

        assertThat(payload.path("bill").path("number").asText()).isEqualTo("1");
        URI uri = client.requests.get(0);
        assertThat(uri.getPath()).isEqualTo("/v3/bill/118/hr/1");
        assertThat(uri.getQuery()).isEqualTo("limit=5&api_key=" + KEY + "&format=json");
    }

    @Test
    @DisplayName("should override caller supplied credential and format")
    void shouldOverrideReservedParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("format", "xml");
        params.put("api_key", "someone-else");
        params.put("q", "clean air");

        URI uri = client.buildUri("/bill", params);

        assertThat(uri.getRawQuery()).isEqualTo("format=json&api_key=" + KEY + "&q=clean+air");
    }

    @Test
    @DisplayName("should fail with NOT_FOUND on 404")
    void shouldFailWithNotFound() {
        client.respondWith(new UpstreamResponse(404, "{\"error\":\"Not Found\"}"));

        CongressApiException error = failure(client.get("/bill/118/hr/99999", Map.of()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("should report a missing response without leaking the credential")
    void shouldReportMissingResponse() {
        client.failWith(new HttpTimeoutException("request to https://api.congress.gov/v3/bill?api_key="
                + KEY + " timed out"));

        CongressApiException error = failure(client.get("/bill", Map.of()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.UPSTREAM_API_ERROR);
        assertThat(error.getUpstreamStatus()).isZero();
        assertThat(error.getMessage()).contains("No response received").doesNotContain(KEY);
    }

    @Test
    @DisplayName("should fail with an internal error on an unparseable success body")
    void shouldFailOnBadJson() {
        client.respondWith(new UpstreamResponse(200, "not json"));

        CongressApiException error = failure(client.get("/bill", Map.of()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.INTERNAL_UNEXPECTED);
        assertThat(error.getMessage()).startsWith("Failed to parse upstream response");
    }

    @Test
    @DisplayName("should fail with an internal error on an empty success body")
    void shouldFailOnEmptyBody() {
        client.respondWith(new UpstreamResponse(200, ""));

        CongressApiException error = failure(client.get("/bill", Map.of()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.INTERNAL_UNEXPECTED);
    }

    @Test
    @DisplayName("should strip a trailing slash from the base URL")
    void shouldStripTrailingSlash() {
        CongressHttpClient slashed = new CongressHttpClient(
                "https://api.congress.gov/v3/", KEY, Duration.ofSeconds(5), Duration.ofSeconds(5));

        assertThat(slashed.getBaseUrl()).isEqualTo("https://api.congress.gov/v3");
    }

    private static CongressApiException failure(CompletableFuture<JsonNode> future) {
        ExecutionException wrapped = catchThrowableOfType(
                () -> future.get(1, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(wrapped).isNotNull();
        return CongressApiException.from(wrapped);
    }

    private static final class RecordingClient extends CongressHttpClient {
        private final List<URI> requests = new ArrayList<>();
        private UpstreamResponse response = new UpstreamResponse(200, "{}");
        private Exception failure;

        RecordingClient() {
            super("https://api.congress.gov/v3", KEY, Duration.ofSeconds(5), Duration.ofSeconds(5));
        }

        void respondWith(UpstreamResponse response) {
            this.response = response;
            this.failure = null;
        }

        void failWith(Exception failure) {
            this.failure = failure;
        }

        @Override
        protected CompletableFuture<UpstreamResponse> send(URI uri) {
            requests.add(uri);
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            return CompletableFuture.completedFuture(response);
        }
    }
}
