package beacon.adapter.in.websocket;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import beacon.config.BrokerConfig;

/**
 * Vert.x route filter that hands WebSocket upgrades on the broker path to the gateway.
 *
 * <p>Upgrades to any other path, and plain HTTP requests, continue through normal routing.
 * Priority 50 runs this ahead of the REST layer.
 */
@ApplicationScoped
public class BrokerUpgradeFilter {

    private static final Logger LOG = Logger.getLogger(BrokerUpgradeFilter.class);

    private final BrokerGateway gateway;
    private final String brokerPath;

    @Inject
    public BrokerUpgradeFilter(BrokerGateway gateway, BrokerConfig config) {
        this.gateway = gateway;
        this.brokerPath = config.path();
    }

    @RouteFilter(50)
    void interceptUpgrade(RoutingContext ctx) {
        final var request = ctx.request();
        if (!isWebSocketUpgrade(request)) {
            ctx.next();
            return;
        }
        if (!brokerPath.equals(request.path())) {
            LOG.debugv("WebSocket upgrade to unknown path: {0}", request.path());
            ctx.next();
            return;
        }
        gateway.handleUpgrade(ctx);
    }

    static boolean isWebSocketUpgrade(HttpServerRequest request) {
        final var upgrade = request.getHeader("Upgrade");
        final var connection = request.getHeader("Connection");

        return "websocket".equalsIgnoreCase(upgrade)
                && connection != null
                && connection.toLowerCase().contains("upgrade");
    }
}
