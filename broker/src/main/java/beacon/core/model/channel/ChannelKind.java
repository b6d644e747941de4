package beacon.core.model.channel;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of broadcast channel, encoded as the prefix of a channel id.
 */
public enum ChannelKind {
    ROLE("role"),
    ORGANIZATION("ngo"),
    USER("user"),
    SYSTEM("system"),
    ROOM("room"),
    DASHBOARD("dashboard"),
    ACTIVITY("activity");

    private final String prefix;

    ChannelKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static Optional<ChannelKind> fromPrefix(String prefix) {
        return Arrays.stream(values()).filter(k -> k.prefix.equals(prefix)).findFirst();
    }
}
