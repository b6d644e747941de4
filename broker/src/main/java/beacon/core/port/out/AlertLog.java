package beacon.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

/**
 * Port interface for the rolling log of emergency alerts.
 */
public interface AlertLog {

    Uni<Void> append(JsonObject alert);

    /**
     * Most recent alerts, newest first.
     */
    Uni<List<JsonObject>> recent(int limit);
}
