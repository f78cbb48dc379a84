package fr.lapetina.congress.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.congress.gateway.api.dto.ApiResponse;
import fr.lapetina.congress.gateway.api.dto.SearchBody;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.identifier.IdentifierParser;
import fr.lapetina.congress.gateway.domain.model.ResourceContents;
import fr.lapetina.congress.gateway.domain.model.SubResourceRequest;
import fr.lapetina.congress.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.congress.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.congress.gateway.service.CongressGateway;
import fr.lapetina.congress.gateway.service.SearchService;
import fr.lapetina.congress.gateway.service.StaticResources;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /api - API description
 * - GET /api/resource?uri=... - Read any congress-gov:// resource
 * - GET /api/bills/{congress}/{type}/{number}[/{sub}] - Bill shortcut
 * - GET /api/members/{bioguideId}[/{sub}] - Member shortcut
 * - GET /api/congress/{congress} - Congress shortcut
 * - GET /api/committees/{chamber}/{code}[/{sub}] - Committee shortcut
 * - GET /api/info/overview, /api/info/current-congress, /api/bill-types - Static resources
 * - POST /api/search - Search a collection
 * - GET /api/subresource?parentUri=&subResource=&limit=&offset= - Sub-resource of an entity
 * - GET /api/rate-limit - Admission window status
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String SCHEME = IdentifierParser.SCHEME_PREFIX;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final CongressGateway gateway;
    private final MetricsRegistry metricsRegistry;
    private final long requestTimeoutMs;
    private final List<Route> routes = new ArrayList<>();

    public HttpServer(
            GatewayConfig.ServerConfig serverConfig,
            CongressGateway gateway,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.gateway = gateway;
        this.metricsRegistry = metricsRegistry;
        this.requestTimeoutMs = serverConfig.getRequestTimeoutMs();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()),
                serverConfig.getBacklog()
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        registerRoutes();

        // Register handlers
        server.createContext("/api", new ApiHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/", new NotFoundHandler());

        log.info("HTTP server configured on {}:{}, workerThreads={}",
                serverConfig.getHost(), serverConfig.getPort(), serverConfig.getWorkerThreads());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== ROUTES ====================

    private void registerRoutes() {
        route("GET", "/api/?", (exchange, m) -> sendJson(exchange, 200, ApiResponse.ok(describeApi())));
        route("GET", "/api/resource", (exchange, m) -> {
            String uri = queryParams(exchange).get("uri");
            if (uri == null || uri.isBlank()) {
                throw CongressApiException.invalidParameter("Missing required query parameter: uri");
            }
            respond(exchange, gateway.readResource(uri));
        });
        route("GET", "/api/bills/([^/]+)/([^/]+)/([^/]+)(/[^/]+)?",
                (exchange, m) -> readShortcut(exchange, "bill", m));
        route("GET", "/api/members/([^/]+)(/[^/]+)?",
                (exchange, m) -> readShortcut(exchange, "member", m));
        route("GET", "/api/congress/([^/]+)",
                (exchange, m) -> readShortcut(exchange, "congress", m));
        route("GET", "/api/committees/([^/]+)/([^/]+)(/[^/]+)?",
                (exchange, m) -> readShortcut(exchange, "committee", m));
        route("GET", "/api/info/overview",
                (exchange, m) -> respond(exchange, gateway.readResource(StaticResources.OVERVIEW)));
        route("GET", "/api/info/current-congress",
                (exchange, m) -> respond(exchange, gateway.readResource(StaticResources.CURRENT_CONGRESS)));
        route("GET", "/api/bill-types",
                (exchange, m) -> respond(exchange, gateway.readResource(StaticResources.BILL_TYPES)));
        route("POST", "/api/search", (exchange, m) -> {
            SearchBody body;
            try (InputStream is = exchange.getRequestBody()) {
                body = objectMapper.readValue(is, SearchBody.class);
            } catch (IOException e) {
                throw CongressApiException.invalidParameter("Invalid JSON body: " + e.getMessage());
            }
            if (body == null) {
                throw CongressApiException.invalidParameter("Request body is required");
            }
            respond(exchange, gateway.search(body.toSearchRequest()));
        });
        route("GET", "/api/subresource", (exchange, m) -> {
            Map<String, String> params = queryParams(exchange);
            SubResourceRequest request = new SubResourceRequest(
                    params.get("parentUri"),
                    params.get("subResource"),
                    optionalInt(params, "limit"),
                    optionalInt(params, "offset"));
            respond(exchange, gateway.getSubResource(request));
        });
        route("GET", "/api/rate-limit",
                (exchange, m) -> sendJson(exchange, 200, ApiResponse.ok(gateway.rateLimitStatus())));
    }

    private void route(String method, String regex, RouteHandler handler) {
        routes.add(new Route(method, Pattern.compile(regex), handler));
    }

    // ==================== API HANDLER ====================

    private class ApiHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                log.info("Request received: method={}, path={}", method, path);

                boolean pathKnown = false;
                for (Route route : routes) {
                    Matcher matcher = route.pattern().matcher(path);
                    if (!matcher.matches()) {
                        continue;
                    }
                    pathKnown = true;
                    if (route.method().equalsIgnoreCase(method)) {
                        route.handler().handle(exchange, matcher);
                        return;
                    }
                }

                if (pathKnown) {
                    sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                } else {
                    sendError(exchange, 404, "NOT_FOUND", "Unknown endpoint: " + path);
                }

            } catch (Exception e) {
                CongressApiException error = CongressApiException.from(e);
                if (error.getKind().isClientError()) {
                    log.info("Request rejected: path={}, kind={}, message={}", path, error.getKind(), error.getMessage());
                } else {
                    log.error("Error handling request: path={}, kind={}", path, error.getKind(), e);
                }
                sendJson(exchange, error.httpStatus(), ApiResponse.fromException(error));
            } finally {
                MDC.clear();
            }
        }
    }

    private void readShortcut(HttpExchange exchange, String collection, Matcher matcher) throws IOException {
        StringBuilder identifier = new StringBuilder(SCHEME).append(collection);
        for (int i = 1; i <= matcher.groupCount(); i++) {
            String group = matcher.group(i);
            if (group == null) {
                continue;
            }
            identifier.append(group.startsWith("/") ? group : "/" + group);
        }
        String rawQuery = exchange.getRequestURI().getRawQuery();
        if (rawQuery != null && !rawQuery.isEmpty()) {
            identifier.append('?').append(rawQuery);
        }
        respond(exchange, gateway.readResource(identifier.toString()));
    }

    /**
     * Waits for the gateway result and writes it, or throws the normalized failure.
     */
    private void respond(HttpExchange exchange, CompletableFuture<ResourceContents> future) throws IOException {
        ResourceContents contents;
        try {
            contents = future.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw CongressApiException.internal("Timed out after " + requestTimeoutMs + "ms waiting for response", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CongressApiException.internal("Interrupted while waiting for response", e);
        } catch (Exception e) {
            throw CongressApiException.from(e);
        }
        sendJson(exchange, 200, ApiResponse.ok(contents));
    }

    private Map<String, Object> describeApi() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", "Congress.gov gateway");
        description.put("version", "v3");
        description.put("identifierScheme", SCHEME);
        description.put("endpoints", List.of(
                "GET /api/resource?uri={congress-gov://...}",
                "GET /api/bills/{congress}/{billType}/{billNumber}[/{subResource}]",
                "GET /api/members/{bioguideId}[/{subResource}]",
                "GET /api/congress/{congress}",
                "GET /api/committees/{chamber}/{committeeCode}[/{subResource}]",
                "GET /api/info/overview",
                "GET /api/info/current-congress",
                "GET /api/bill-types",
                "POST /api/search",
                "GET /api/subresource?parentUri=&subResource=&limit=&offset=",
                "GET /api/rate-limit",
                "GET /health",
                "GET /metrics"));
        description.put("searchCollections", SearchService.SEARCHABLE_COLLECTIONS);
        return description;
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("admission", gateway.rateLimitStatus());

            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    private class NotFoundHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            sendError(exchange, 404, "NOT_FOUND", "Unknown endpoint: " + exchange.getRequestURI().getPath());
        }
    }

    // ==================== HELPER METHODS ====================

    private static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String rawQuery = exchange.getRequestURI().getRawQuery();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            try {
                params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                throw CongressApiException.invalidParameter("Malformed query string: " + rawQuery);
            }
        }
        return params;
    }

    private static Integer optionalInt(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw CongressApiException.invalidParameter("Invalid " + name + " '" + value + "'. Must be an integer.");
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String code, String message) throws IOException {
        sendJson(exchange, statusCode, ApiResponse.error(code, message, null));
    }

    @FunctionalInterface
    private interface RouteHandler {
        void handle(HttpExchange exchange, Matcher matcher) throws IOException;
    }

    private record Route(String method, Pattern pattern, RouteHandler handler) {
    }
}
