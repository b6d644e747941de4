package beacon.adapter.out.storage.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import beacon.core.port.out.SharedStoreMonitor;

/**
 * Checks Redis with {@code PING}.
 */
public class RedisSharedStoreMonitor implements SharedStoreMonitor {

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSharedStoreMonitor(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> ping() {
        var operation = redisDataSource
                .execute("PING")
                .map(response -> response != null && "PONG".equalsIgnoreCase(response.toString()));
        return timeoutHelper.withTimeoutFallback(operation, "ping", () -> false);
    }

    @Override
    public boolean isShared() {
        return true;
    }
}
