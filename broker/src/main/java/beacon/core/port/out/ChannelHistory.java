package beacon.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;

/**
 * Port interface for the rolling per-channel message log.
 */
public interface ChannelHistory {

    /**
     * Append a message, trimming the log to its configured length.
     */
    Uni<Void> append(ChannelId channelId, JsonObject message);

    /**
     * Read the most recent messages, newest first.
     *
     * @param channelId the channel
     * @param limit     maximum number of messages
     * @return messages, empty when unavailable
     */
    Uni<List<JsonObject>> recent(ChannelId channelId, int limit);
}
