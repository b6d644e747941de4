package beacon.adapter.in.websocket;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import beacon.config.BrokerConfig;
import beacon.core.model.connection.ClientInfo;
import beacon.core.model.event.BrokerError;
import beacon.core.model.identity.Identity;
import beacon.core.model.lifecycle.Admission;
import beacon.core.service.BrokerOrchestrator;
import beacon.core.service.ConnectionRegistry;
import beacon.core.service.EventRouter;

/**
 * Performs the broker handshake and upgrades admitted requests.
 *
 * <p>All checks complete before the upgrade, so a refused client receives a plain HTTP
 * response:
 * <ul>
 *   <li>403 when the Origin is not allowed</li>
 *   <li>503 when the instance is at its connection limit</li>
 *   <li>401 when the credential is missing or invalid, or the identity is unknown</li>
 *   <li>429 with {@code Retry-After} when connection attempts are rate limited</li>
 * </ul>
 */
@ApplicationScoped
public class BrokerGateway {

    private static final Logger LOG = Logger.getLogger(BrokerGateway.class);

    static final String PLATFORM_HEADER = "x-platform";
    static final String TOKEN_PARAM = "token";

    private final BrokerOrchestrator orchestrator;
    private final ConnectionRegistry registry;
    private final EventRouter router;
    private final BrokerConfig config;
    private final Vertx vertx;

    @Inject
    public BrokerGateway(
            BrokerOrchestrator orchestrator,
            ConnectionRegistry registry,
            EventRouter router,
            BrokerConfig config,
            Vertx vertx) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.router = router;
        this.config = config;
        this.vertx = vertx;
    }

    public void handleUpgrade(RoutingContext ctx) {
        final var request = ctx.request();

        if (!isOriginAllowed(request.getHeader("Origin"))) {
            LOG.warnv("WebSocket origin rejected: {0}", request.getHeader("Origin"));
            end(ctx, 403, "Forbidden", "Origin not allowed");
            return;
        }

        if (registry.connectionCount() >= config.maxConnections()) {
            LOG.warnv("WebSocket connection limit reached ({0})", config.maxConnections());
            end(ctx, 503, "Service Unavailable", "Connection limit reached");
            return;
        }

        orchestrator
                .admit(extractToken(request))
                .subscribe()
                .with(
                        admission -> {
                            if (admission instanceof Admission.Admitted admitted) {
                                upgrade(ctx, admitted.identity());
                            } else {
                                refuse(ctx, (Admission.Rejected) admission);
                            }
                        },
                        error -> {
                            LOG.errorv(error, "WebSocket handshake failed");
                            end(ctx, 500, "Internal Server Error", "Internal error");
                        });
    }

    private void upgrade(RoutingContext ctx, Identity identity) {
        final var clientInfo = clientInfo(ctx.request());
        ctx.request()
                .toWebSocket()
                .onSuccess(ws -> {
                    final var heartbeat = config.heartbeat();
                    new ClientSession(
                                    ws,
                                    orchestrator,
                                    router,
                                    vertx,
                                    config.maxFrameBytes(),
                                    heartbeat.enabled(),
                                    heartbeat.interval(),
                                    heartbeat.timeout())
                            .start(identity, clientInfo);
                })
                .onFailure(error -> {
                    LOG.warnv("WebSocket upgrade failed for user {0}: {1}", identity.userId(), error.getMessage());
                    if (!ctx.response().ended()) {
                        end(ctx, 500, "Internal Server Error", "Upgrade failed");
                    }
                });
    }

    private void refuse(RoutingContext ctx, Admission.Rejected rejected) {
        if (rejected.error() == BrokerError.RATE_LIMITED) {
            ctx.response().putHeader("Retry-After", String.valueOf(rejected.retryAfterSeconds()));
            end(ctx, 429, "Too Many Requests", rejected.reason());
            return;
        }
        end(ctx, 401, "Unauthorized", rejected.reason());
    }

    boolean isOriginAllowed(String origin) {
        if (origin == null) {
            return true;
        }
        final List<String> allowed = config.allowedOrigins().orElse(List.of());
        return allowed.isEmpty() || allowed.contains("*") || allowed.contains(origin);
    }

    static Optional<String> extractToken(HttpServerRequest request) {
        final var authorization = request.getHeader("Authorization");
        if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
            final var token = authorization.substring(7).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }
        final var queryToken = request.getParam(TOKEN_PARAM);
        return queryToken != null && !queryToken.isBlank() ? Optional.of(queryToken) : Optional.empty();
    }

    static ClientInfo clientInfo(HttpServerRequest request) {
        final var forwarded = request.getHeader("X-Forwarded-For");
        String remote = null;
        if (forwarded != null && !forwarded.isBlank()) {
            remote = forwarded.split(",")[0].trim();
        } else if (request.remoteAddress() != null) {
            remote = request.remoteAddress().host();
        }
        return ClientInfo.from(request.getHeader("User-Agent"), request.getHeader(PLATFORM_HEADER), remote);
    }

    private static void end(RoutingContext ctx, int status, String title, String detail) {
        ctx.response()
                .setStatusCode(status)
                .putHeader("Content-Type", "application/problem+json")
                .end(new JsonObject()
                        .put("title", title)
                        .put("status", status)
                        .put("detail", detail)
                        .encode());
    }
}
