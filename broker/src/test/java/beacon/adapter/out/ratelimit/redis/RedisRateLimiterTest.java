package beacon.adapter.out.ratelimit.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import beacon.adapter.out.storage.redis.RedisTimeoutHelper;
import beacon.core.port.out.Metrics;
import beacon.core.service.SharedStoreState;

@DisplayName("RedisRateLimiter")
@ExtendWith(MockitoExtension.class)
class RedisRateLimiterTest {

    @Mock
    private ReactiveRedisDataSource redisDataSource;

    @Mock
    private Metrics metrics;

    private RedisRateLimiter limiter;

    @BeforeEach
    void setUp() {
        var storeState = new SharedStoreState();
        storeState.markAvailable();
        limiter = new RedisRateLimiter(
                redisDataSource, new RedisTimeoutHelper(Duration.ofSeconds(1), metrics, storeState, "rate-limiter"));
    }

    @Test
    @DisplayName("should leave expiry to the counters' time-to-live")
    void shouldNotTouchRedisOnCleanup() {
        var removed = limiter.cleanupExpired().await().atMost(Duration.ofSeconds(1));

        assertEquals(0L, removed);
        verifyNoInteractions(redisDataSource);
    }

    @Test
    @DisplayName("should be named after its store")
    void shouldBeNamedRedis() {
        assertEquals("redis", limiter.name());
    }
}
