package fr.lapetina.congress.gateway.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a reload has produced a valid configuration.
     *
     * @param oldConfig The previous configuration (may be null on initial load)
     * @param newConfig The new configuration, environment overrides already applied
     */
    void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig);
}
