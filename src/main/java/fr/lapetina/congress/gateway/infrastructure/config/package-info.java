/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML is parsed into {@link fr.lapetina.congress.gateway.infrastructure.config.GatewayConfig},
 * then environment variables override individual settings and the result is validated.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.congress.gateway.infrastructure.config.GatewayConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.congress.gateway.infrastructure.config.ConfigLoader} - YAML loading, overrides and file watching</li>
 *   <li>{@link fr.lapetina.congress.gateway.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Environment Overrides</h2>
 * <ul>
 *   <li>{@code CONGRESS_GOV_API_KEY} - upstream credential (required)</li>
 *   <li>{@code CONGRESS_GOV_API_URL}, {@code CONGRESS_GOV_API_TIMEOUT} - upstream base URL and timeout</li>
 *   <li>{@code RATE_LIMIT_MAX_REQUESTS}, {@code RATE_LIMIT_PER_HOURS} - admission window</li>
 *   <li>{@code ENABLE_BACKOFF} - parsed only</li>
 *   <li>{@code PORT} - HTTP listen port</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code api} - Congress.gov base URL, credential and timeouts</li>
 *   <li>{@code rateLimit} - admission window size and length</li>
 *   <li>{@code validation} - congress and district bounds</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.congress.gateway.infrastructure.config;
