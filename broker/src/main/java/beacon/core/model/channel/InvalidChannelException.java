package beacon.core.model.channel;

import beacon.core.model.event.BrokerError;
import beacon.core.model.event.BrokerException;

/**
 * Thrown when a channel id is malformed.
 */
public class InvalidChannelException extends BrokerException {

    private final String channelId;

    public InvalidChannelException(String channelId) {
        super(BrokerError.INVALID_CHANNEL, "Invalid channel id: " + channelId);
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
