package beacon.adapter.out.storage;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import beacon.adapter.out.storage.memory.InMemoryAlertLog;
import beacon.adapter.out.storage.memory.InMemoryChannelHistory;
import beacon.adapter.out.storage.memory.InMemoryConnectionReplica;
import beacon.adapter.out.storage.memory.InMemoryNotificationReceipts;
import beacon.adapter.out.storage.memory.LocalSharedStoreMonitor;
import beacon.adapter.out.storage.redis.RedisAlertLog;
import beacon.adapter.out.storage.redis.RedisChannelHistory;
import beacon.adapter.out.storage.redis.RedisConnectionReplica;
import beacon.adapter.out.storage.redis.RedisNotificationReceipts;
import beacon.adapter.out.storage.redis.RedisSharedStoreMonitor;
import beacon.adapter.out.storage.redis.RedisTimeoutHelper;
import beacon.config.SharedStoreConfig;
import beacon.core.port.out.AlertLog;
import beacon.core.port.out.ChannelHistory;
import beacon.core.port.out.ConnectionReplica;
import beacon.core.port.out.Metrics;
import beacon.core.port.out.NotificationReceipts;
import beacon.core.port.out.SharedStoreMonitor;
import beacon.core.service.SharedStoreState;

/**
 * CDI producer for the shared store adapters.
 *
 * <p>Selects Redis when the shared store is enabled and a {@link ReactiveRedisDataSource} is
 * available; otherwise every port is served from memory and the broker runs in single-process
 * mode. Redis-backed history, receipts and alerts keep an in-memory twin that serves calls while
 * Redis is unavailable.
 */
@ApplicationScoped
public class SharedStoreProducer {

    private static final Logger LOG = Logger.getLogger(SharedStoreProducer.class);

    private final SharedStoreConfig config;
    private final SharedStoreState storeState;
    private final Metrics metrics;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public SharedStoreProducer(
            SharedStoreConfig config,
            SharedStoreState storeState,
            Metrics metrics,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.storeState = storeState;
        this.metrics = metrics;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public ConnectionReplica connectionReplica() {
        return redis().<ConnectionReplica>map(ds -> new RedisConnectionReplica(ds, helper("connection-replica")))
                .orElseGet(InMemoryConnectionReplica::new);
    }

    @Produces
    @ApplicationScoped
    public ChannelHistory channelHistory() {
        final var local = new InMemoryChannelHistory(config.channelHistorySize());
        return redis().<ChannelHistory>map(ds ->
                        new RedisChannelHistory(ds, config.channelHistorySize(), local, helper("channel-history")))
                .orElse(local);
    }

    @Produces
    @ApplicationScoped
    public NotificationReceipts notificationReceipts() {
        final var local = new InMemoryNotificationReceipts();
        return redis().<NotificationReceipts>map(
                        ds -> new RedisNotificationReceipts(ds, local, helper("notification-receipts")))
                .orElse(local);
    }

    @Produces
    @ApplicationScoped
    public AlertLog alertLog() {
        final var local = new InMemoryAlertLog(config.alertLogSize());
        return redis().<AlertLog>map(ds -> new RedisAlertLog(ds, config.alertLogSize(), local, helper("alert-log")))
                .orElse(local);
    }

    @Produces
    @ApplicationScoped
    public SharedStoreMonitor sharedStoreMonitor() {
        final var monitor = redis().<SharedStoreMonitor>map(ds -> new RedisSharedStoreMonitor(ds, helper("monitor")))
                .orElseGet(LocalSharedStoreMonitor::new);
        LOG.infov("Shared store mode: {0}", monitor.isShared() ? "redis" : "local");
        return monitor;
    }

    private Optional<ReactiveRedisDataSource> redis() {
        if (!config.enabled()) {
            LOG.debug("Shared store disabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Shared store enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            return Optional.of(redisDataSource.get());
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis data source, using in-memory storage");
            return Optional.empty();
        }
    }

    private RedisTimeoutHelper helper(String repositoryName) {
        return new RedisTimeoutHelper(config.timeout(), metrics, storeState, repositoryName);
    }
}
