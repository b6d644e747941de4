package beacon.adapter.in.bootstrap;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import beacon.core.service.BrokerOrchestrator;

/**
 * Starts the broker with the application and closes every connection on shutdown.
 */
@ApplicationScoped
public class BrokerLifecycle {

    private static final Logger LOG = Logger.getLogger(BrokerLifecycle.class);

    static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final BrokerOrchestrator orchestrator;

    @Inject
    public BrokerLifecycle(BrokerOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Starting broker");
        orchestrator.initialize().await().atMost(STARTUP_TIMEOUT);
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.info("Stopping broker");
        orchestrator.shutdown();
    }
}
