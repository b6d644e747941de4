package beacon.core.model.channel;

import java.util.Map;

/**
 * Point-in-time channel statistics.
 *
 * @param totalChannels    number of channels with at least one member
 * @param totalMemberships number of (identity, channel) pairs
 * @param byKind           channel count per kind
 */
public record ChannelStats(int totalChannels, int totalMemberships, Map<ChannelKind, Integer> byKind) {

    public ChannelStats {
        byKind = byKind != null ? Map.copyOf(byKind) : Map.of();
    }
}
