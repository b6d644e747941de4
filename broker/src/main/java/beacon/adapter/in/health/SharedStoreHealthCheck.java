package beacon.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import beacon.core.port.out.SharedStoreMonitor;
import beacon.core.service.SharedStoreState;

/**
 * Readiness check reporting the shared store mode.
 *
 * <p>Always UP. A broker without its shared store keeps serving its own connections, so a
 * degraded store is reported through the {@code mode} data and metrics, not readiness.
 */
@Readiness
@ApplicationScoped
public class SharedStoreHealthCheck implements HealthCheck {

    private final SharedStoreState storeState;
    private final SharedStoreMonitor storeMonitor;

    @Inject
    public SharedStoreHealthCheck(SharedStoreState storeState, SharedStoreMonitor storeMonitor) {
        this.storeState = storeState;
        this.storeMonitor = storeMonitor;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("shared-store");
        builder.withData("configured", storeMonitor.isShared());
        builder.withData("mode", storeState.isAvailable() ? "shared" : "local");
        builder.withData(
                "lastCheck", storeState.lastCheckAt().map(Object::toString).orElse("never"));
        return builder.up().build();
    }
}
