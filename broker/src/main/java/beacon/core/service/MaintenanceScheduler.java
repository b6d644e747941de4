package beacon.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Periodic broker housekeeping.
 *
 * <p>Each task is independent and skipped while the broker is not running. Tasks never
 * overlap with themselves.
 */
@ApplicationScoped
public class MaintenanceScheduler {

    private static final Logger LOG = Logger.getLogger(MaintenanceScheduler.class);

    private final BrokerOrchestrator orchestrator;

    @Inject
    public MaintenanceScheduler(BrokerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(
            every = "${beacon.broker.maintenance.reap-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void reapStaleConnections() {
        if (!orchestrator.isRunning()) {
            return;
        }
        final var reaped = orchestrator.reapStaleConnections();
        if (reaped > 0) {
            LOG.infov("Closed {0} idle connections", reaped);
        }
    }

    @Scheduled(
            every = "${beacon.broker.maintenance.rate-limit-cleanup-interval:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> cleanupRateLimits() {
        if (!orchestrator.isRunning()) {
            return Uni.createFrom().voidItem();
        }
        return orchestrator.cleanupRateLimits().replaceWithVoid();
    }

    @Scheduled(
            every = "${beacon.broker.maintenance.store-health-interval:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> checkSharedStore() {
        if (!orchestrator.isRunning()) {
            return Uni.createFrom().voidItem();
        }
        return orchestrator.checkSharedStore().replaceWithVoid();
    }

    @Scheduled(
            every = "${beacon.broker.maintenance.stats-interval:10m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void logStatistics() {
        if (orchestrator.isRunning()) {
            orchestrator.logStatistics();
        }
    }
}
