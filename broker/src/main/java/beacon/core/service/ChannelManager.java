package beacon.core.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.channel.ChannelKind;
import beacon.core.model.channel.ChannelStats;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Identity;
import beacon.core.port.out.Metrics;

/**
 * Manages channel membership and channel-scoped broadcast.
 *
 * <p>Membership is tracked per identity, not per transport: a member with several devices
 * receives each broadcast on every live connection. Membership changes for a channel are
 * serialised through {@link ConcurrentHashMap#compute} on that channel, which also updates the
 * per-identity index; member sets are concurrent so broadcasts can read them without locking.
 * Empty channels are discarded.
 */
@ApplicationScoped
public class ChannelManager {

    private static final Logger LOG = Logger.getLogger(ChannelManager.class);

    private final ConcurrentHashMap<ChannelId, Channel> channels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<ChannelId>> channelsByIdentity = new ConcurrentHashMap<>();

    private final ConnectionRegistry registry;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public ChannelManager(ConnectionRegistry registry, Metrics metrics) {
        this(registry, metrics, Clock.systemUTC());
    }

    ChannelManager(ConnectionRegistry registry, Metrics metrics, Clock clock) {
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Channels every identity is enrolled in at connect time.
     *
     * @param identity the identity
     * @return role channel, organization channel (if any), personal channel, system notifications
     */
    public static List<ChannelId> defaultChannelsFor(Identity identity) {
        final var defaults = new ArrayList<ChannelId>(4);
        defaults.add(ChannelId.role(identity.role()));
        identity.organizationId().ifPresent(org -> defaults.add(ChannelId.organization(org)));
        defaults.add(ChannelId.user(identity.userId()));
        defaults.add(ChannelId.SYSTEM_NOTIFICATIONS);
        return defaults;
    }

    /**
     * Join a channel. Joining a channel twice is a no-op.
     *
     * @param connection the requesting connection
     * @param channelId  the channel
     * @return true if a new membership was created
     * @throws BrokerException with FORBIDDEN if the identity may not join the channel
     */
    public boolean join(Connection connection, ChannelId channelId) {
        final var identity = connection.identity();
        if (!canJoin(identity, channelId)) {
            throw BrokerException.forbidden("You do not have permission to join " + channelId);
        }

        final var added = addMembership(identity.userId(), channelId);
        if (added) {
            LOG.debugv("User {0} joined {1}", identity.userId(), channelId);
            if (channelId.kind() == ChannelKind.ROOM) {
                broadcast(
                        channelId,
                        roomEvent("user_joined", channelId, identity.userId(), "userName", identity.displayName()),
                        Optional.empty());
            }
        }
        return added;
    }

    /**
     * Leave a channel.
     *
     * @param connection the requesting connection
     * @param channelId  the channel
     * @return true if a membership was removed, false if the identity was not a member
     * @throws BrokerException with FORBIDDEN for the identity's default channels
     */
    public boolean leave(Connection connection, ChannelId channelId) {
        final var identity = connection.identity();
        if (defaultChannelsFor(identity).contains(channelId)) {
            throw BrokerException.forbidden("Default channels cannot be left");
        }

        final var removed = removeMembership(identity.userId(), channelId);
        if (removed) {
            LOG.debugv("User {0} left {1}", identity.userId(), channelId);
            if (channelId.kind() == ChannelKind.ROOM) {
                broadcast(
                        channelId,
                        roomEvent("user_left", channelId, identity.userId(), "userName", identity.displayName()),
                        Optional.empty());
            }
        }
        return removed;
    }

    /**
     * Enroll a connection's identity in its default channels.
     *
     * @param connection the connection
     * @return the default channels
     */
    public List<ChannelId> joinDefaultChannels(Connection connection) {
        final var defaults = defaultChannelsFor(connection.identity());
        for (var channelId : defaults) {
            addMembership(connection.userId(), channelId);
        }
        return defaults;
    }

    /**
     * Remove an identity from every channel. Called once it has no connections left.
     *
     * @param userId the identity
     * @return the channels it was removed from
     */
    public Set<ChannelId> removeIdentityFromAllChannels(String userId) {
        final var removedFrom = channelsOf(userId);
        for (var channelId : removedFrom) {
            removeMembership(userId, channelId);
            if (channelId.kind() == ChannelKind.ROOM) {
                broadcast(channelId, roomEvent("user_left", channelId, userId, "reason", "disconnected"), Optional.empty());
            }
        }
        if (!removedFrom.isEmpty()) {
            LOG.debugv("Removed user {0} from {1} channels", userId, removedFrom.size());
        }
        return removedFrom;
    }

    /**
     * Deliver an event to every member of a channel.
     *
     * @param channelId       the channel
     * @param event           the event
     * @param excludeIdentity identity whose connections are skipped, typically the sender
     * @return number of sockets written
     */
    public int broadcast(ChannelId channelId, OutboundEvent event, Optional<String> excludeIdentity) {
        final var delivered = deliver(membersOf(channelId), event, excludeIdentity);
        metrics.recordBroadcast(channelId.kind().prefix(), delivered);
        return delivered;
    }

    /**
     * Deliver an event once to every member of any of the channels.
     *
     * @return number of sockets written
     */
    public int broadcastToChannels(Collection<ChannelId> channelIds, OutboundEvent event, Optional<String> excludeIdentity) {
        final var recipients = new LinkedHashSet<String>();
        for (var channelId : channelIds) {
            recipients.addAll(membersOf(channelId));
        }
        final var delivered = deliver(recipients, event, excludeIdentity);
        metrics.recordBroadcast("multi", delivered);
        return delivered;
    }

    public Set<String> membersOf(ChannelId channelId) {
        final var channel = channels.get(channelId);
        return channel != null ? Set.copyOf(channel.members) : Set.of();
    }

    public Set<ChannelId> channelsOf(String userId) {
        final var memberships = channelsByIdentity.get(userId);
        return memberships != null ? Set.copyOf(memberships) : Set.of();
    }

    public boolean isMember(String userId, ChannelId channelId) {
        final var channel = channels.get(channelId);
        return channel != null && channel.members.contains(userId);
    }

    public Optional<Instant> createdAt(ChannelId channelId) {
        return Optional.ofNullable(channels.get(channelId)).map(channel -> channel.createdAt);
    }

    public int channelCount() {
        return channels.size();
    }

    public ChannelStats stats() {
        final Map<ChannelKind, Integer> byKind = new EnumMap<>(ChannelKind.class);
        var memberships = 0;
        for (var entry : channels.entrySet()) {
            byKind.merge(entry.getKey().kind(), 1, Integer::sum);
            memberships += entry.getValue().members.size();
        }
        return new ChannelStats(channels.size(), memberships, byKind);
    }

    /**
     * Check whether an identity may join a channel explicitly.
     *
     * <p>Platform administrators may join any channel. Everyone else may join only their own
     * role, organization and personal channels, the dashboard and activity feeds of their role
     * and organization, plus system and ad hoc rooms.
     */
    public boolean canJoin(Identity identity, ChannelId channelId) {
        if (identity.isPlatformAdmin()) {
            return true;
        }
        switch (channelId.kind()) {
            case ROLE:
                return identity.hasRole(channelId.name());
            case ORGANIZATION:
                return identity.organizationId().map(channelId.name()::equals).orElse(false);
            case USER:
                return identity.userId().equals(channelId.name());
            case DASHBOARD:
                return identity.hasRole(channelId.name());
            case ACTIVITY:
                return identity.hasRole(channelId.name())
                        || identity.organizationId()
                                .map(org -> channelId.name().equals(ChannelId.ORGANIZATION_ACTIVITY_PREFIX + org))
                                .orElse(false);
            case SYSTEM:
            case ROOM:
                return true;
            default:
                return false;
        }
    }

    // The identity index is updated inside the channel's compute, so both maps change together.
    private boolean addMembership(String userId, ChannelId channelId) {
        final var added = new AtomicBoolean(false);
        channels.compute(channelId, (id, existing) -> {
            final var channel = existing != null ? existing : new Channel(clock.instant());
            added.set(channel.members.add(userId));
            channelsByIdentity.compute(userId, (member, memberships) -> {
                final Set<ChannelId> updated = memberships != null ? memberships : ConcurrentHashMap.newKeySet();
                updated.add(channelId);
                return updated;
            });
            return channel;
        });
        return added.get();
    }

    private boolean removeMembership(String userId, ChannelId channelId) {
        final var removed = new AtomicBoolean(false);
        channels.compute(channelId, (id, channel) -> {
            if (channel != null) {
                removed.set(channel.members.remove(userId));
            }
            channelsByIdentity.computeIfPresent(userId, (member, memberships) -> {
                memberships.remove(channelId);
                return memberships.isEmpty() ? null : memberships;
            });
            return channel == null || channel.members.isEmpty() ? null : channel;
        });
        return removed.get();
    }

    private int deliver(Collection<String> recipients, OutboundEvent event, Optional<String> excludeIdentity) {
        var delivered = 0;
        for (var userId : recipients) {
            if (excludeIdentity.isPresent() && excludeIdentity.get().equals(userId)) {
                continue;
            }
            delivered += registry.deliverToIdentity(userId, event);
        }
        return delivered;
    }

    private OutboundEvent roomEvent(String type, ChannelId channelId, String userId, String detailKey, String detail) {
        final var now = clock.instant().toString();
        return OutboundEvent.of(
                OutboundEvent.ROOM_EVENT,
                new JsonObject()
                        .put("type", type)
                        .put("roomId", channelId.value())
                        .put("userId", userId)
                        .put("data", new JsonObject().put(detailKey, detail).put("timestamp", now))
                        .put("timestamp", now));
    }

    private static final class Channel {
        private final Set<String> members = ConcurrentHashMap.newKeySet();
        private final Instant createdAt;

        private Channel(Instant createdAt) {
            this.createdAt = createdAt;
        }
    }
}
