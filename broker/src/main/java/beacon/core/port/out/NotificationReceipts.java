package beacon.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for notification read receipts.
 */
public interface NotificationReceipts {

    Uni<Void> markRead(String userId, String notificationId);

    Uni<Boolean> isRead(String userId, String notificationId);
}
