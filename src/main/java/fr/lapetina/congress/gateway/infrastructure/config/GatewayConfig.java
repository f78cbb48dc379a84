package fr.lapetina.congress.gateway.infrastructure.config;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML, then overridden from the environment by {@link ConfigLoader}.
 */
public class GatewayConfig {

    static final String MISSING_API_KEY =
            "Missing required Congress.gov API key. Set CONGRESS_GOV_API_KEY environment variable.";

    private ServerConfig server = new ServerConfig();
    private ApiConfig api = new ApiConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private ValidationConfig validation = new ValidationConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ApiConfig getApi() { return api; }
    public void setApi(ApiConfig api) { this.api = api; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks the settings that make startup impossible.
     *
     * @throws ConfigLoader.ConfigurationException on the first violation
     */
    public void validate() {
        if (api.getApiKey() == null || api.getApiKey().isBlank()) {
            throw new ConfigLoader.ConfigurationException(MISSING_API_KEY);
        }
        if (api.getBaseUrl() == null || api.getBaseUrl().isBlank()) {
            throw new ConfigLoader.ConfigurationException("api.baseUrl is required");
        }
        if (api.getTimeoutMs() <= 0) {
            throw new ConfigLoader.ConfigurationException("api.timeoutMs must be > 0: " + api.getTimeoutMs());
        }
        if (rateLimit.getMaxRequests() <= 0) {
            throw new ConfigLoader.ConfigurationException(
                    "rateLimit.maxRequests must be > 0: " + rateLimit.getMaxRequests());
        }
        if (rateLimit.getWindowHours() <= 0) {
            throw new ConfigLoader.ConfigurationException(
                    "rateLimit.windowHours must be > 0: " + rateLimit.getWindowHours());
        }
        if (server.getWorkerThreads() <= 0) {
            throw new ConfigLoader.ConfigurationException(
                    "server.workerThreads must be > 0: " + server.getWorkerThreads());
        }
        if (validation.getMinCongress() < 1 || validation.getMaxCongress() < validation.getMinCongress()) {
            throw new ConfigLoader.ConfigurationException("Invalid validation congress range: "
                    + validation.getMinCongress() + ".." + validation.getMaxCongress());
        }
        if (validation.getMaxDistrict() < 0) {
            throw new ConfigLoader.ConfigurationException(
                    "validation.maxDistrict must be >= 0: " + validation.getMaxDistrict());
        }
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 3000;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 16;
        private long requestTimeoutMs = 60000;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Upstream Congress.gov API configuration.
     */
    public static class ApiConfig {
        private String apiKey = "";
        private String baseUrl = "https://api.congress.gov/v3";
        private long timeoutMs = 30000;
        private long connectTimeoutMs = 10000;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        @Override
        public String toString() {
            return "ApiConfig{baseUrl=" + baseUrl + ", timeoutMs=" + timeoutMs
                    + ", apiKey=" + (apiKey == null || apiKey.isEmpty() ? "<unset>" : "[REDACTED]") + "}";
        }
    }

    /**
     * Rolling admission window configuration.
     */
    public static class RateLimitConfig {
        private int maxRequests = 5000;
        private int windowHours = 1;
        private boolean enableBackoff = true;

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public int getWindowHours() { return windowHours; }
        public void setWindowHours(int windowHours) { this.windowHours = windowHours; }

        public boolean isEnableBackoff() { return enableBackoff; }
        public void setEnableBackoff(boolean enableBackoff) { this.enableBackoff = enableBackoff; }
    }

    /**
     * Identifier field bounds.
     */
    public static class ValidationConfig {
        private int minCongress = 93;
        private int maxCongress = 118;
        private int maxDistrict = 53;

        public int getMinCongress() { return minCongress; }
        public void setMinCongress(int minCongress) { this.minCongress = minCongress; }

        public int getMaxCongress() { return maxCongress; }
        public void setMaxCongress(int maxCongress) { this.maxCongress = maxCongress; }

        public int getMaxDistrict() { return maxDistrict; }
        public void setMaxDistrict(int maxDistrict) { this.maxDistrict = maxDistrict; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "congress_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
