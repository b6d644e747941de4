package beacon.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import beacon.core.model.connection.ConnectionRecord;
import beacon.core.model.connection.PresenceStatus;
import beacon.core.port.out.ConnectionReplica;

/**
 * Redis implementation of ConnectionReplica.
 *
 * <p>Layout:
 * <ul>
 *   <li>{@code user_connections} hash: field userId, value JSON array of connection records</li>
 *   <li>{@code user_status} hash: field userId, value the presence status ({@code online}, ...)</li>
 * </ul>
 *
 * <p>Writes are silent on failure; reads degrade to empty results.
 */
public class RedisConnectionReplica implements ConnectionReplica {

    private static final Logger LOG = Logger.getLogger(RedisConnectionReplica.class);

    static final String CONNECTIONS_KEY = "user_connections";
    static final String STATUS_KEY = "user_status";

    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisConnectionReplica(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> saveConnections(String userId, List<ConnectionRecord> connections) {
        final var records = new JsonArray();
        connections.forEach(record -> records.add(toJson(record)));
        var operation = hashCommands.hset(CONNECTIONS_KEY, userId, records.encode()).replaceWithVoid();
        return timeoutHelper.withTimeoutSilent(operation, "saveConnections");
    }

    @Override
    public Uni<Void> removeConnections(String userId) {
        var operation = hashCommands.hdel(CONNECTIONS_KEY, userId).replaceWithVoid();
        return timeoutHelper.withTimeoutSilent(operation, "removeConnections");
    }

    @Override
    public Uni<List<ConnectionRecord>> connectionsOf(String userId) {
        var operation = hashCommands.hget(CONNECTIONS_KEY, userId);
        return timeoutHelper
                .withTimeoutGraceful(operation, "connectionsOf")
                .map(value -> value.map(RedisConnectionReplica::parseRecords).orElse(List.of()));
    }

    @Override
    public Uni<Void> saveStatus(String userId, PresenceStatus status, Instant at) {
        var operation = hashCommands.hset(STATUS_KEY, userId, status.wireValue()).replaceWithVoid();
        return timeoutHelper.withTimeoutSilent(operation, "saveStatus");
    }

    @Override
    public Uni<Optional<PresenceStatus>> statusOf(String userId) {
        var operation = hashCommands.hget(STATUS_KEY, userId);
        return timeoutHelper
                .withTimeoutGraceful(operation, "statusOf")
                .map(value -> value.flatMap(PresenceStatus::fromWire));
    }

    static JsonObject toJson(ConnectionRecord record) {
        return new JsonObject()
                .put("sessionId", record.sessionId())
                .put("userId", record.userId())
                .put("displayName", record.displayName())
                .put("role", record.role())
                .put("organizationId", record.organizationId())
                .put("device", record.device())
                .put("userAgent", record.userAgent())
                .put("connectedAt", record.connectedAtMillis())
                .put("lastActivity", record.lastActivityMillis());
    }

    static List<ConnectionRecord> parseRecords(String value) {
        final var records = new ArrayList<ConnectionRecord>();
        try {
            final var array = new JsonArray(value);
            for (var i = 0; i < array.size(); i++) {
                final var json = array.getJsonObject(i);
                records.add(new ConnectionRecord(
                        json.getString("sessionId"),
                        json.getString("userId"),
                        json.getString("displayName"),
                        json.getString("role"),
                        json.getString("organizationId"),
                        json.getString("device"),
                        json.getString("userAgent"),
                        json.getLong("connectedAt", 0L),
                        json.getLong("lastActivity", 0L)));
            }
        } catch (DecodeException | ClassCastException e) {
            LOG.warnv("Ignoring malformed replicated connection list: {0}", e.getMessage());
            return List.of();
        }
        return records;
    }
}
