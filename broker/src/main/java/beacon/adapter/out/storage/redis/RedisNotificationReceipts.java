package beacon.adapter.out.storage.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.smallrye.mutiny.Uni;

import beacon.core.port.out.NotificationReceipts;

/**
 * Redis implementation of NotificationReceipts.
 *
 * <p>Receipts live in the hash {@code user_notifications:{userId}}, field notificationId, value
 * {@code read}.
 */
public class RedisNotificationReceipts implements NotificationReceipts {

    static final String KEY_PREFIX = "user_notifications:";
    static final String READ = "read";

    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final NotificationReceipts localReceipts;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisNotificationReceipts(
            ReactiveRedisDataSource redisDataSource,
            NotificationReceipts localReceipts,
            RedisTimeoutHelper timeoutHelper) {
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.localReceipts = localReceipts;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> markRead(String userId, String notificationId) {
        return timeoutHelper.withLocalFallback(
                () -> hashCommands.hset(KEY_PREFIX + userId, notificationId, READ).replaceWithVoid(),
                "markRead",
                () -> localReceipts.markRead(userId, notificationId));
    }

    @Override
    public Uni<Boolean> isRead(String userId, String notificationId) {
        return timeoutHelper.withLocalFallback(
                () -> hashCommands.hget(KEY_PREFIX + userId, notificationId).map(READ::equals),
                "isRead",
                () -> localReceipts.isRead(userId, notificationId));
    }
}
