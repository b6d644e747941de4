package beacon.adapter.out.storage.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.port.out.AlertLog;

/**
 * In-memory rolling emergency alert log, newest first.
 */
public class InMemoryAlertLog implements AlertLog {

    private final Deque<JsonObject> alerts = new ArrayDeque<>();
    private final int maxSize;

    public InMemoryAlertLog(int maxSize) {
        this.maxSize = maxSize;
    }

    @Override
    public Uni<Void> append(JsonObject alert) {
        synchronized (alerts) {
            alerts.addFirst(alert.copy());
            while (alerts.size() > maxSize) {
                alerts.removeLast();
            }
        }
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<List<JsonObject>> recent(int limit) {
        final var result = new ArrayList<JsonObject>();
        synchronized (alerts) {
            for (var alert : alerts) {
                if (result.size() >= limit) {
                    break;
                }
                result.add(alert.copy());
            }
        }
        return Uni.createFrom().item(result);
    }
}
