package beacon.adapter.out.storage.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.port.out.ChannelHistory;

/**
 * In-memory rolling channel history, newest message first.
 */
public class InMemoryChannelHistory implements ChannelHistory {

    private final ConcurrentMap<ChannelId, Deque<JsonObject>> messages = new ConcurrentHashMap<>();
    private final int maxSize;

    public InMemoryChannelHistory(int maxSize) {
        this.maxSize = maxSize;
    }

    @Override
    public Uni<Void> append(ChannelId channelId, JsonObject message) {
        messages.compute(channelId, (id, existing) -> {
            final var log = existing != null ? existing : new ArrayDeque<JsonObject>();
            log.addFirst(message.copy());
            while (log.size() > maxSize) {
                log.removeLast();
            }
            return log;
        });
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<List<JsonObject>> recent(ChannelId channelId, int limit) {
        final var result = new ArrayList<JsonObject>();
        messages.computeIfPresent(channelId, (id, log) -> {
            for (var message : log) {
                if (result.size() >= limit) {
                    break;
                }
                result.add(message.copy());
            }
            return log;
        });
        return Uni.createFrom().item(result);
    }
}
