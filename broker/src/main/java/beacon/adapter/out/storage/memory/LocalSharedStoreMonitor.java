package beacon.adapter.out.storage.memory;

import io.smallrye.mutiny.Uni;

import beacon.core.port.out.SharedStoreMonitor;

/**
 * Monitor used when no shared store is configured. The broker stays in single-process mode.
 */
public class LocalSharedStoreMonitor implements SharedStoreMonitor {

    @Override
    public Uni<Boolean> ping() {
        return Uni.createFrom().item(false);
    }

    @Override
    public boolean isShared() {
        return false;
    }
}
