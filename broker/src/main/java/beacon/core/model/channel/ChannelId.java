package beacon.core.model.channel;

import java.util.regex.Pattern;

/**
 * Identifier of a broadcast channel in the form {@code kind:name}.
 *
 * <p>Examples: {@code role:donor}, {@code ngo:42}, {@code user:u-1}, {@code system:notifications},
 * {@code room:fundraiser-2024}, {@code dashboard:donor}, {@code activity:ngo.42}.
 *
 * @param kind the channel kind
 * @param name the name within the kind
 */
public record ChannelId(ChannelKind kind, String name) {

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.@\\-]{1,128}");

    public static final String ORGANIZATION_ACTIVITY_PREFIX = "ngo.";

    public static final ChannelId SYSTEM_NOTIFICATIONS = new ChannelId(ChannelKind.SYSTEM, "notifications");

    public ChannelId {
        if (kind == null) {
            throw new IllegalArgumentException("Channel kind cannot be null");
        }
        if (name == null || !NAME.matcher(name).matches()) {
            throw new InvalidChannelException((kind.prefix()) + ":" + name);
        }
    }

    /**
     * Parse a channel id.
     *
     * @param value the raw id
     * @return the parsed id
     * @throws InvalidChannelException if the id is malformed
     */
    public static ChannelId parse(String value) {
        if (value == null) {
            throw new InvalidChannelException("null");
        }
        final var separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new InvalidChannelException(value);
        }
        final var kind = ChannelKind.fromPrefix(value.substring(0, separator))
                .orElseThrow(() -> new InvalidChannelException(value));
        return new ChannelId(kind, value.substring(separator + 1));
    }

    public static ChannelId role(String role) {
        return new ChannelId(ChannelKind.ROLE, role);
    }

    public static ChannelId organization(String organizationId) {
        return new ChannelId(ChannelKind.ORGANIZATION, organizationId);
    }

    public static ChannelId user(String userId) {
        return new ChannelId(ChannelKind.USER, userId);
    }

    public static ChannelId dashboard(String role) {
        return new ChannelId(ChannelKind.DASHBOARD, role);
    }

    public static ChannelId roleActivity(String role) {
        return new ChannelId(ChannelKind.ACTIVITY, role);
    }

    public static ChannelId organizationActivity(String organizationId) {
        return new ChannelId(ChannelKind.ACTIVITY, ORGANIZATION_ACTIVITY_PREFIX + organizationId);
    }

    public String value() {
        return kind.prefix() + ":" + name;
    }

    @Override
    public String toString() {
        return value();
    }
}
