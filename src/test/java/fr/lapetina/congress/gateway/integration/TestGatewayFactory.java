package fr.lapetina.congress.gateway.integration;

import fr.lapetina.congress.gateway.GatewayFactory;
import fr.lapetina.congress.gateway.infrastructure.http.CongressHttpClient;
import fr.lapetina.congress.gateway.infrastructure.http.UpstreamResponse;
import fr.lapetina.congress.gateway.infrastructure.ratelimit.MutableClock;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test extension of GatewayFactory that replaces the network with a stub and the clock with a
 * manually advanced one.
 */
public final class TestGatewayFactory extends GatewayFactory {

    private final StubHttpClient stubHttpClient;
    private final MutableClock clock;

    private TestGatewayFactory(String configPath, StubHttpClient stub, MutableClock clock) {
        super(configPath, Map.of(), stub, clock);
        this.stubHttpClient = stub;
        this.clock = clock;
    }

    /**
     * Creates a test factory from the default test configuration.
     */
    public static TestGatewayFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates a test factory from a custom configuration path.
     */
    public static TestGatewayFactory create(String configPath) {
        TestGatewayFactory factory = new TestGatewayFactory(
                configPath,
                new StubHttpClient(),
                new MutableClock(Instant.parse("2024-01-15T10:00:00Z")));
        factory.start();
        return factory;
    }

    /**
     * Sets the stub response generator for upstream requests.
     */
    public void setHttpResponse(Function<URI, UpstreamResponse> responseGenerator) {
        stubHttpClient.setResponseGenerator(responseGenerator);
    }

    /**
     * Answers every request with the same status and body.
     */
    public void setResponse(int status, String body) {
        stubHttpClient.setResponseGenerator(uri -> new UpstreamResponse(status, body));
    }

    /**
     * Fails every request as if no response had been received.
     */
    public void setErrorResponse(Exception exception) {
        stubHttpClient.setException(exception);
    }

    /**
     * URIs that actually reached the stub, in order.
     */
    public List<URI> getSentRequests() {
        return stubHttpClient.sent;
    }

    public void advanceClock(Duration duration) {
        clock.advance(duration);
    }

    /**
     * Stub HTTP client for testing.
     */
    static class StubHttpClient extends CongressHttpClient {
        private final List<URI> sent = new CopyOnWriteArrayList<>();
        private Function<URI, UpstreamResponse> responseGenerator;
        private Exception exception;

        StubHttpClient() {
            super("http://localhost:9/v3", "test-secret-key", Duration.ofSeconds(2), Duration.ofSeconds(1));
        }

        void setResponseGenerator(Function<URI, UpstreamResponse> generator) {
            this.responseGenerator = generator;
            this.exception = null;
        }

        void setException(Exception exception) {
            this.exception = exception;
            this.responseGenerator = null;
        }

        @Override
        protected CompletableFuture<UpstreamResponse> send(URI uri) {
            sent.add(uri);
            if (exception != null) {
                return CompletableFuture.failedFuture(exception);
            }
            if (responseGenerator == null) {
                return CompletableFuture.completedFuture(new UpstreamResponse(200, "{\"request\":{\"format\":\"json\"}}"));
            }
            try {
                return CompletableFuture.completedFuture(responseGenerator.apply(uri));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }
}
