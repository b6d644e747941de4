package beacon.adapter.out.storage.redis;

import java.util.List;
import java.util.stream.Collectors;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.list.ReactiveListCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.port.out.ChannelHistory;

/**
 * Redis implementation of ChannelHistory.
 *
 * <p>Each channel is a list at {@code room_messages:{channelId}}, newest first, trimmed to the
 * configured length on every append. Served by the local history while the store is down.
 */
public class RedisChannelHistory implements ChannelHistory {

    static final String KEY_PREFIX = "room_messages:";

    private final ReactiveListCommands<String, String> listCommands;
    private final int maxSize;
    private final ChannelHistory localHistory;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisChannelHistory(
            ReactiveRedisDataSource redisDataSource,
            int maxSize,
            ChannelHistory localHistory,
            RedisTimeoutHelper timeoutHelper) {
        this.listCommands = redisDataSource.list(String.class);
        this.maxSize = maxSize;
        this.localHistory = localHistory;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> append(ChannelId channelId, JsonObject message) {
        final var key = KEY_PREFIX + channelId.value();
        return timeoutHelper.withLocalFallback(
                () -> listCommands
                        .lpush(key, message.encode())
                        .flatMap(length -> listCommands.ltrim(key, 0, maxSize - 1)),
                "append",
                () -> localHistory.append(channelId, message));
    }

    @Override
    public Uni<List<JsonObject>> recent(ChannelId channelId, int limit) {
        final var key = KEY_PREFIX + channelId.value();
        return timeoutHelper.withLocalFallback(
                () -> listCommands
                        .lrange(key, 0, limit - 1)
                        .map(values -> values.stream().map(JsonObject::new).collect(Collectors.toList())),
                "recent",
                () -> localHistory.recent(channelId, limit));
    }
}
