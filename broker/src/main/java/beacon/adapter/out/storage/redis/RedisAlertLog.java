package beacon.adapter.out.storage.redis;

import java.util.List;
import java.util.stream.Collectors;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.list.ReactiveListCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.port.out.AlertLog;

/**
 * Redis implementation of AlertLog: the list {@code emergency_alerts}, newest first.
 */
public class RedisAlertLog implements AlertLog {

    static final String KEY = "emergency_alerts";

    private final ReactiveListCommands<String, String> listCommands;
    private final int maxSize;
    private final AlertLog localLog;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisAlertLog(
            ReactiveRedisDataSource redisDataSource, int maxSize, AlertLog localLog, RedisTimeoutHelper timeoutHelper) {
        this.listCommands = redisDataSource.list(String.class);
        this.maxSize = maxSize;
        this.localLog = localLog;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> append(JsonObject alert) {
        return timeoutHelper.withLocalFallback(
                () -> listCommands
                        .lpush(KEY, alert.encode())
                        .flatMap(length -> listCommands.ltrim(KEY, 0, maxSize - 1)),
                "append",
                () -> localLog.append(alert));
    }

    @Override
    public Uni<List<JsonObject>> recent(int limit) {
        return timeoutHelper.withLocalFallback(
                () -> listCommands
                        .lrange(KEY, 0, limit - 1)
                        .map(values -> values.stream().map(JsonObject::new).collect(Collectors.toList())),
                "recent",
                () -> localLog.recent(limit));
    }
}
