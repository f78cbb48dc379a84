package fr.lapetina.congress.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.infrastructure.http.CongressHttpClient;
import fr.lapetina.congress.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.congress.gateway.infrastructure.ratelimit.AdmissionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Admission-controlled upstream call.
 *
 * A slot is reserved in the {@link AdmissionWindow} before the request leaves; when the window is
 * full the returned future fails immediately and nothing is sent. A call that fails hands its slot
 * back, so only successful calls count against the budget.
 */
public class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private final AdmissionWindow admissionWindow;
    private final CongressHttpClient httpClient;
    private final MetricsRegistry metricsRegistry;

    public RequestExecutor(AdmissionWindow admissionWindow, CongressHttpClient httpClient, MetricsRegistry metricsRegistry) {
        this.admissionWindow = admissionWindow;
        this.httpClient = httpClient;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * @return the upstream payload, or a future failed with {@link CongressApiException}
     */
    public CompletableFuture<JsonNode> execute(String endpoint, Map<String, String> params) {
        AdmissionWindow.Reservation reservation;
        try {
            reservation = admissionWindow.acquire();
        } catch (CongressApiException e) {
            return CompletableFuture.failedFuture(e);
        }

        String collection = collectionOf(endpoint);
        Instant start = Instant.now();
        CompletableFuture<JsonNode> call;
        try {
            call = httpClient.get(endpoint, params);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.whenComplete((payload, ex) -> {
            metricsRegistry.recordUpstreamLatency(collection, Duration.between(start, Instant.now()));
            if (ex != null) {
                admissionWindow.cancel(reservation);
                log.debug("Upstream call failed, slot released: endpoint={}, remaining={}",
                        endpoint, admissionWindow.remaining());
            }
        });
    }

    public AdmissionWindow getAdmissionWindow() {
        return admissionWindow;
    }

    /**
     * First path segment, used as the metrics label.
     */
    static String collectionOf(String endpoint) {
        String path = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
        int slash = path.indexOf('/');
        return slash < 0 ? path : path.substring(0, slash);
    }
}
