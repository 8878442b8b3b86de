package fr.lapetina.dispatch;

import fr.lapetina.dispatch.api.AdminServer;
import fr.lapetina.dispatch.api.UnixSocketServer;
import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the actor dispatch tier.
 */
public class DispatchApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchApplication.class);

    private final DispatcherFactory factory;
    private final UnixSocketServer socketServer;
    private final AdminServer adminServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public DispatchApplication(String configPath) throws Exception {
        log.info("Starting actor dispatch tier...");

        this.factory = DispatcherFactory.create(configPath).start();
        DispatchConfig config = factory.getConfig();

        this.socketServer = new UnixSocketServer(
                config.getServer(),
                factory.getConnectionHandler(),
                factory.getMetricsRegistry()
        );

        if (config.getAdmin().isEnabled()) {
            this.adminServer = new AdminServer(
                    config.getAdmin().getHost(),
                    config.getAdmin().getPort(),
                    config.getAdmin().getBacklog(),
                    factory.getManager(),
                    factory.getPool(),
                    factory.getMetricsRegistry(),
                    factory.getConfigLoader()
            );
        } else {
            this.adminServer = null;
        }

        log.info("Actor dispatch tier initialized");
    }

    public void start() throws Exception {
        socketServer.start();
        if (adminServer != null) {
            adminServer.start();
        }
        log.info("Actor dispatch tier listening on {}", socketServer.getSocketPath());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public DispatcherFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down actor dispatch tier...");

        try {
            socketServer.close();
        } catch (Exception e) {
            log.warn("Error closing socket server", e);
        }

        if (adminServer != null) {
            try {
                adminServer.close();
            } catch (Exception e) {
                log.warn("Error closing admin server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Actor dispatch tier shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            DispatchApplication app = new DispatchApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start actor dispatch tier", e);
            System.exit(1);
        }
    }
}
