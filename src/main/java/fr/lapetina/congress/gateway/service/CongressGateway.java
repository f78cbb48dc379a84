package fr.lapetina.congress.gateway.service;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.identifier.IdentifierDispatcher;
import fr.lapetina.congress.gateway.domain.model.RateLimitStatus;
import fr.lapetina.congress.gateway.domain.model.ResourceContents;
import fr.lapetina.congress.gateway.domain.model.ResourceRequest;
import fr.lapetina.congress.gateway.domain.model.SearchRequest;
import fr.lapetina.congress.gateway.domain.model.SubResourceRequest;
import fr.lapetina.congress.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.congress.gateway.infrastructure.ratelimit.AdmissionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single entry point for every gateway operation.
 *
 * <p>Each operation runs the same pipeline: resolve and validate the identifier, reserve an
 * admission slot, call upstream, wrap the payload. Every failure surfaces as a future completed
 * with {@link CongressApiException}; nothing is thrown synchronously from the async operations.
 */
public class CongressGateway {

    private static final Logger log = LoggerFactory.getLogger(CongressGateway.class);

    static final String STATIC_LABEL = "static";
    static final String SEARCH_LABEL = "search";
    static final String UNRESOLVED_LABEL = "unresolved";

    private final IdentifierDispatcher dispatcher;
    private final RequestExecutor executor;
    private final ResponseEnvelopeBuilder envelopeBuilder;
    private final StaticResources staticResources;
    private final SearchService searchService;
    private final SubResourceService subResourceService;
    private final MetricsRegistry metricsRegistry;

    public CongressGateway(
            IdentifierDispatcher dispatcher,
            RequestExecutor executor,
            ResponseEnvelopeBuilder envelopeBuilder,
            StaticResources staticResources,
            SearchService searchService,
            SubResourceService subResourceService,
            MetricsRegistry metricsRegistry
    ) {
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.envelopeBuilder = envelopeBuilder;
        this.staticResources = staticResources;
        this.searchService = searchService;
        this.subResourceService = subResourceService;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Reads one resource by identifier.
     */
    public CompletableFuture<ResourceContents> readResource(String identifier) {
        Optional<Map<String, Object>> staticPayload = staticResources.lookup(identifier);
        if (staticPayload.isPresent()) {
            log.debug("Serving static resource: uri={}", identifier);
            return track(STATIC_LABEL, identifier,
                    () -> CompletableFuture.completedFuture(envelopeBuilder.wrap(identifier, staticPayload.get())));
        }

        ResourceRequest request;
        try {
            request = dispatcher.resolve(identifier);
        } catch (RuntimeException e) {
            return track(UNRESOLVED_LABEL, identifier, () -> CompletableFuture.failedFuture(e));
        }
        return fetch(request);
    }

    /**
     * Resolves without any network call or budget use.
     *
     * @throws CongressApiException of kind INVALID_IDENTIFIER or INVALID_PARAMETER
     */
    public ResourceRequest resolve(String identifier) {
        return dispatcher.resolve(identifier);
    }

    public CompletableFuture<ResourceContents> search(SearchRequest request) {
        String collection = request.collection() == null ? "" : request.collection().trim().toLowerCase(Locale.ROOT);
        String uri = SearchService.envelopeUri(collection);
        return track(SEARCH_LABEL, uri, () -> searchService.search(request)
                .thenApply(payload -> envelopeBuilder.wrap(uri, payload)));
    }

    public CompletableFuture<ResourceContents> getSubResource(SubResourceRequest request) {
        ResourceRequest resolved;
        try {
            resolved = subResourceService.resolve(request);
        } catch (RuntimeException e) {
            return track(UNRESOLVED_LABEL, request.parentUri(), () -> CompletableFuture.failedFuture(e));
        }
        return fetch(resolved);
    }

    public RateLimitStatus rateLimitStatus() {
        AdmissionWindow window = executor.getAdmissionWindow();
        return new RateLimitStatus(
                window.remaining(),
                window.getMaxRequests(),
                window.getWindowHours(),
                window.recordedCount(),
                window.resetTime().orElse(null));
    }

    private CompletableFuture<ResourceContents> fetch(ResourceRequest request) {
        return track(request.collection().getTag(), request.identifier(),
                () -> executor.execute(request.endpoint(), request.query())
                        .thenApply(payload -> envelopeBuilder.wrap(request.identifier(), payload)));
    }

    /**
     * Runs {@code operation}, counts the outcome and normalizes any failure to
     * {@link CongressApiException}.
     */
    private CompletableFuture<ResourceContents> track(
            String label,
            String identifier,
            Supplier<CompletableFuture<ResourceContents>> operation
    ) {
        CompletableFuture<ResourceContents> source;
        try {
            source = operation.get();
        } catch (RuntimeException e) {
            source = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ResourceContents> result = new CompletableFuture<>();
        source.whenComplete((contents, ex) -> {
            if (ex == null) {
                metricsRegistry.incrementRequestCount(label, MetricsRegistry.OUTCOME_SUCCESS);
                result.complete(contents);
                return;
            }
            CongressApiException error = CongressApiException.from(ex);
            metricsRegistry.incrementRequestCount(label, MetricsRegistry.OUTCOME_ERROR);
            metricsRegistry.incrementErrorCount(label, error.getKind());
            if (error.getKind().isClientError()) {
                log.info("Request rejected: uri={}, kind={}, message={}", identifier, error.getKind(), error.getMessage());
            } else {
                log.warn("Request failed: uri={}, kind={}, message={}", identifier, error.getKind(), error.getMessage());
            }
            result.completeExceptionally(error);
        });
        return result;
    }
}
