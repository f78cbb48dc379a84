package fr.lapetina.congress.gateway;

import fr.lapetina.congress.gateway.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Congress.gov gateway.
 */
public class CongressGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CongressGatewayApplication.class);

    private final GatewayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public CongressGatewayApplication(String configPath) throws Exception {
        log.info("Starting Congress.gov gateway...");

        this.factory = GatewayFactory.create(configPath).start();

        this.httpServer = new HttpServer(
                factory.getConfig().getServer(),
                factory.getGateway(),
                factory.getMetricsRegistry()
        );

        log.info("Congress.gov gateway initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Congress.gov gateway started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public GatewayFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Congress.gov gateway...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Congress.gov gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            CongressGatewayApplication app = new CongressGatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Congress.gov gateway", e);
            System.exit(1);
        }
    }
}
