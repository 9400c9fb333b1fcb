package fr.lapetina.scheduler;

import fr.lapetina.scheduler.api.AdminHttpServer;
import fr.lapetina.scheduler.infrastructure.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for a tenant scheduler replica.
 */
public class TenantSchedulerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TenantSchedulerApplication.class);

    private final SchedulerFactory factory;
    private final AdminHttpServer adminServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public TenantSchedulerApplication(String configPath) throws Exception {
        log.info("Starting Tenant Scheduler...");

        this.factory = SchedulerFactory.create(configPath).start();

        SchedulerConfig.ServerConfig server = factory.getConfig().getServer();
        if (server.isEnabled()) {
            this.adminServer = new AdminHttpServer(
                    server.getPort(),
                    server.getBacklog(),
                    server.getThreads(),
                    factory.getReplicaId(),
                    factory.getPipeline(),
                    factory.getWorkerPool(),
                    factory.getSharedState().deadLetterQueue(),
                    factory.getGovernor(),
                    factory.getConfig().getMetrics().isEnabled() ? factory.getMetricsRegistry() : null,
                    factory.getConfigLoader() != null ? factory::reloadConfiguration : null
            );
        } else {
            this.adminServer = null;
        }

        log.info("Tenant Scheduler initialized: replicaId={}", factory.getReplicaId());
    }

    public void start() {
        if (adminServer != null) {
            adminServer.start();
            log.info("Tenant Scheduler started: replicaId={}, adminPort={}",
                    factory.getReplicaId(), adminServer.getPort());
        } else {
            log.info("Tenant Scheduler started without admin server: replicaId={}", factory.getReplicaId());
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public SchedulerFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Tenant Scheduler...");

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

        log.info("Tenant Scheduler shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            TenantSchedulerApplication app = new TenantSchedulerApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Tenant Scheduler", e);
            System.exit(1);
        }
    }
}
