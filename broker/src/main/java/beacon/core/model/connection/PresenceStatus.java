package beacon.core.model.connection;

import java.util.Arrays;
import java.util.Optional;

/**
 * Presence of an identity as announced to other clients.
 */
public enum PresenceStatus {
    ONLINE("online"),
    AWAY("away"),
    BUSY("busy"),
    OFFLINE("offline");

    private final String wireValue;

    PresenceStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<PresenceStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(s -> s.wireValue.equals(value)).findFirst();
    }
}
