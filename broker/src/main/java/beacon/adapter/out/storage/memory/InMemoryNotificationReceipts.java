package beacon.adapter.out.storage.memory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import beacon.core.port.out.NotificationReceipts;

/**
 * In-memory notification read receipts.
 */
public class InMemoryNotificationReceipts implements NotificationReceipts {

    private final ConcurrentMap<String, Set<String>> readByUser = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> markRead(String userId, String notificationId) {
        readByUser.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(notificationId);
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Boolean> isRead(String userId, String notificationId) {
        final var read = readByUser.get(userId);
        return Uni.createFrom().item(read != null && read.contains(notificationId));
    }
}
