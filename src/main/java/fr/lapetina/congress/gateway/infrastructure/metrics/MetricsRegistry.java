package fr.lapetina.congress.gateway.infrastructure.metrics;

import fr.lapetina.congress.gateway.domain.model.ErrorKind;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request outcome counters per collection
 * - Error counters per collection and kind
 * - Upstream latency timers per collection
 * - Remaining admission budget gauge
 * - JVM and system metrics, Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ERROR = "error";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("congress_gateway");
    }

    /**
     * Counts one finished gateway operation.
     *
     * @param collection collection tag, or {@code search} / {@code static}
     * @param outcome    {@link #OUTCOME_SUCCESS} or {@link #OUTCOME_ERROR}
     */
    public void incrementRequestCount(String collection, String outcome) {
        String key = collection + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of gateway requests")
                        .tag("collection", collection)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void incrementErrorCount(String collection, ErrorKind kind) {
        String key = collection + ":" + kind.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors by kind")
                        .tag("collection", collection)
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the duration of one upstream call, successful or not.
     */
    public void recordUpstreamLatency(String collection, Duration latency) {
        latencyTimers.computeIfAbsent(collection, k ->
                Timer.builder(prefix + "_upstream_latency")
                        .description("Congress.gov API call latency")
                        .tag("collection", collection)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void registerAdmissionRemaining(Supplier<Number> remaining) {
        Gauge.builder(prefix + "_admission_remaining", remaining, s -> s.get().doubleValue())
                .description("Upstream calls still admissible in the current window")
                .register(registry);
    }

    public double requestCount(String collection, String outcome) {
        Counter counter = requestCounters.get(collection + ":" + outcome);
        return counter != null ? counter.count() : 0;
    }

    public double errorCount(String collection, ErrorKind kind) {
        Counter counter = errorCounters.get(collection + ":" + kind.name());
        return counter != null ? counter.count() : 0;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
