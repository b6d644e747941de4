package beacon.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import beacon.core.port.out.Metrics;
import beacon.core.service.SharedStoreState;

/**
 * Helper for applying timeouts and failure handling to Redis operations with graceful degradation.
 *
 * <p>Every timeout or failure is recorded and marks the shared store unavailable; only the
 * periodic health check marks it available again.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: fails with {@link RedisTimeoutException} on timeout,
 *       propagates other failures. Use where the caller has its own fallback.</li>
 *   <li>{@link #withTimeoutGraceful} - Fail-soft: returns empty Optional on timeout or any failure.
 *       Use for reads where missing data is acceptable.</li>
 *   <li>{@link #withTimeoutFallback} - Returns a fixed fallback on timeout or any failure.</li>
 *   <li>{@link #withTimeoutSilent} - Fire-and-forget: logs but ignores timeout or any failure.
 *       Use for replication writes.</li>
 *   <li>{@link #withLocalFallback} - Runs a local substitute while the store is unavailable, and
 *       whenever the Redis operation times out or fails.</li>
 * </ul>
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final SharedStoreState storeState;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout        the timeout duration for Redis operations
     * @param metrics        the metrics instance for recording timeouts (may be null)
     * @param storeState     shared store availability, marked down on failures
     * @param repositoryName the repository name for logs and metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, SharedStoreState storeState, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeState = storeState;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply timeout to an operation that should fail on timeout.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, repositoryName);
                })
                .onFailure(error -> !(error instanceof RedisTimeoutException))
                .invoke(error -> recordFailure(operationName, error));
    }

    /**
     * Apply timeout with graceful degradation to empty Optional.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni that returns empty Optional on timeout or failure
     */
    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<T> operation, String operationName) {
        return operation
                .map(Optional::ofNullable)
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (graceful): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return Optional.empty();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    recordFailure(operationName, error);
                    return Optional.empty();
                });
    }

    /**
     * Apply timeout with a fixed fallback value.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback      supplier for fallback value on timeout or failure
     * @param <T>           the result type
     * @return a Uni that returns the fallback value on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (fallback): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    recordFailure(operationName, error);
                    return fallback.get();
                });
    }

    /**
     * Apply timeout with silent failure (fire-and-forget operations).
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (silent): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    recordFailure(operationName, error);
                    return null;
                });
    }

    /**
     * Run a Redis operation, or its local substitute when the store cannot serve it.
     *
     * <p>The Redis operation is not even subscribed to while the store is marked unavailable.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback      local substitute
     * @param <T>           the result type
     * @return the result of whichever side served the call
     */
    public <T> Uni<T> withLocalFallback(Supplier<Uni<T>> operation, String operationName, Supplier<Uni<T>> fallback) {
        if (!storeState.isAvailable()) {
            return fallback.get();
        }
        return withTimeout(Uni.createFrom().deferred(operation::get), operationName)
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.debugv("Serving {0} in {1} locally: {2}", operationName, repositoryName, error.getMessage());
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(repositoryName, operationName);
        }
        storeState.markUnavailable(repositoryName + "." + operationName + " timed out");
    }

    private void recordFailure(String operationName, Throwable error) {
        LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, repositoryName, error.getMessage());
        if (metrics != null) {
            metrics.recordStoreFailure(repositoryName, operationName);
        }
        storeState.markUnavailable(repositoryName + "." + operationName + " failed");
    }

    public String repositoryName() {
        return repositoryName;
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        public String getOperation() {
            return operation;
        }

        public String getRepository() {
            return repository;
        }
    }
}
