package fr.lapetina.congress.gateway.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Environment variable overrides applied on every load
 * - File watching for automatic reload, with listener notification
 *
 * A configuration that fails {@link GatewayConfig#validate()} is never published.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_API_KEY = "CONGRESS_GOV_API_KEY";
    public static final String ENV_API_URL = "CONGRESS_GOV_API_URL";
    public static final String ENV_API_TIMEOUT = "CONGRESS_GOV_API_TIMEOUT";
    public static final String ENV_MAX_REQUESTS = "RATE_LIMIT_MAX_REQUESTS";
    public static final String ENV_WINDOW_HOURS = "RATE_LIMIT_PER_HOURS";
    public static final String ENV_ENABLE_BACKOFF = "ENABLE_BACKOFF";
    public static final String ENV_PORT = "PORT";

    private final AtomicReference<GatewayConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * @param environment source of overrides; tests pass a fixed map
     */
    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Map.copyOf(environment);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(GatewayConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath, applies overrides and validates.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public GatewayConfig load() {
        return publish(loadFromPath());
    }

    /**
     * Loads configuration from an input stream, applies overrides and validates.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private GatewayConfig publish(GatewayConfig config) {
        applyEnvironment(config);
        config.validate();
        if (config.getRateLimit().isEnableBackoff()) {
            log.info("rateLimit.enableBackoff is set but backoff is not implemented; requests are never retried");
        }
        GatewayConfig previous = currentConfig.getAndSet(config);
        log.info("Configuration loaded: {}, maxRequests={}, windowHours={}, port={}",
                config.getApi(), config.getRateLimit().getMaxRequests(),
                config.getRateLimit().getWindowHours(), config.getServer().getPort());
        notifyListeners(previous, config);
        return config;
    }

    private GatewayConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private GatewayConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private GatewayConfig parse(InputStream is, String source) {
        try {
            GatewayConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new GatewayConfig();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    // ==================== ENVIRONMENT ====================

    private void applyEnvironment(GatewayConfig config) {
        String apiKey = env(ENV_API_KEY);
        if (apiKey != null) {
            config.getApi().setApiKey(apiKey);
        }
        String baseUrl = env(ENV_API_URL);
        if (baseUrl != null) {
            config.getApi().setBaseUrl(baseUrl);
        }
        String timeout = env(ENV_API_TIMEOUT);
        if (timeout != null) {
            config.getApi().setTimeoutMs(parseLong(ENV_API_TIMEOUT, timeout));
        }
        String maxRequests = env(ENV_MAX_REQUESTS);
        if (maxRequests != null) {
            config.getRateLimit().setMaxRequests(parseInt(ENV_MAX_REQUESTS, maxRequests));
        }
        String windowHours = env(ENV_WINDOW_HOURS);
        if (windowHours != null) {
            config.getRateLimit().setWindowHours(parseInt(ENV_WINDOW_HOURS, windowHours));
        }
        String backoff = env(ENV_ENABLE_BACKOFF);
        if (backoff != null) {
            config.getRateLimit().setEnableBackoff(!"false".equals(backoff.trim().toLowerCase(Locale.ROOT)));
        }
        String port = env(ENV_PORT);
        if (port != null) {
            config.getServer().setPort(parseInt(ENV_PORT, port));
        }
    }

    private String env(String name) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + name + ": " + value, e);
        }
    }

    // ==================== HOT RELOAD ====================

    /**
     * Returns the current configuration.
     */
    public GatewayConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Editors fire several events per save
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. An invalid file keeps the current configuration.
     */
    public GatewayConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(GatewayConfig oldConfig, GatewayConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
