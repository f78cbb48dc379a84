package fr.lapetina.congress.gateway;

import fr.lapetina.congress.gateway.domain.identifier.IdentifierDispatcher;
import fr.lapetina.congress.gateway.domain.identifier.ResourceRouteTable;
import fr.lapetina.congress.gateway.domain.validation.ParameterValidator;
import fr.lapetina.congress.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.congress.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.congress.gateway.infrastructure.http.CongressHttpClient;
import fr.lapetina.congress.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.congress.gateway.infrastructure.ratelimit.AdmissionWindow;
import fr.lapetina.congress.gateway.service.CongressGateway;
import fr.lapetina.congress.gateway.service.RequestExecutor;
import fr.lapetina.congress.gateway.service.ResponseEnvelopeBuilder;
import fr.lapetina.congress.gateway.service.SearchService;
import fr.lapetina.congress.gateway.service.StaticResources;
import fr.lapetina.congress.gateway.service.SubResourceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Factory for creating a fully-wired {@link CongressGateway} from configuration.
 * This is the primary entry point for obtaining a configured gateway.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml")) {
 *     CongressGateway gateway = factory.getGateway();
 *     // use gateway...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final ConfigLoader configLoader;
    private final GatewayConfig config;
    private final MetricsRegistry metricsRegistry;
    private final CongressHttpClient httpClient;
    private final AdmissionWindow admissionWindow;
    private final IdentifierDispatcher dispatcher;
    private final CongressGateway gateway;

    protected GatewayFactory(
            String configPath,
            Map<String, String> environment,
            CongressHttpClient httpClientOverride,
            Clock clock
    ) {
        log.info("Initializing GatewayFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath, environment);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize HTTP client (allow override for testing)
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        this.admissionWindow = new AdmissionWindow(
                config.getRateLimit().getMaxRequests(),
                config.getRateLimit().getWindowHours(),
                clock
        );
        metricsRegistry.registerAdmissionRemaining(admissionWindow::remaining);

        GatewayConfig.ValidationConfig bounds = config.getValidation();
        ParameterValidator validator = new ParameterValidator(
                bounds.getMinCongress(), bounds.getMaxCongress(), bounds.getMaxDistrict());
        this.dispatcher = new IdentifierDispatcher(ResourceRouteTable.standard(validator));

        RequestExecutor executor = new RequestExecutor(admissionWindow, httpClient, metricsRegistry);
        this.gateway = new CongressGateway(
                dispatcher,
                executor,
                new ResponseEnvelopeBuilder(httpClient.getObjectMapper()),
                new StaticResources(),
                new SearchService(executor, validator),
                new SubResourceService(dispatcher, validator),
                metricsRegistry
        );

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("GatewayFactory initialized: {} routes, maxRequests={}, windowHours={}",
                dispatcher.getRoutes().all().size(),
                config.getRateLimit().getMaxRequests(),
                config.getRateLimit().getWindowHours());
    }

    /**
     * Creates a factory from the specified configuration file and the process environment.
     */
    public static GatewayFactory create(String configPath) {
        return new GatewayFactory(configPath, System.getenv(), null, Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static GatewayFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts configuration file watching.
     */
    public GatewayFactory start() {
        configLoader.startWatching();
        log.info("Gateway started");
        return this;
    }

    public CongressGateway getGateway() {
        return gateway;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public CongressHttpClient getHttpClient() {
        return httpClient;
    }

    public AdmissionWindow getAdmissionWindow() {
        return admissionWindow;
    }

    public IdentifierDispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Configuration as loaded at startup. Reloads only change the admission limits.
     */
    public GatewayConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private CongressHttpClient createHttpClient() {
        GatewayConfig.ApiConfig api = config.getApi();
        return new CongressHttpClient(
                api.getBaseUrl(),
                api.getApiKey(),
                Duration.ofMillis(api.getTimeoutMs()),
                Duration.ofMillis(api.getConnectTimeoutMs())
        );
    }

    private void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        admissionWindow.updateLimits(
                newConfig.getRateLimit().getMaxRequests(),
                newConfig.getRateLimit().getWindowHours()
        );

        if (oldConfig != null && !oldConfig.getApi().getBaseUrl().equals(newConfig.getApi().getBaseUrl())) {
            log.warn("api.baseUrl changed to {}; restart required to take effect", newConfig.getApi().getBaseUrl());
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("GatewayFactory shut down");
    }
}
