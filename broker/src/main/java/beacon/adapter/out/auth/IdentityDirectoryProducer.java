package beacon.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import beacon.config.AuthConfig;
import beacon.core.port.out.IdentityDirectory;

/**
 * CDI producer for the identity directory selected by {@code beacon.auth.directory.mode}.
 */
@ApplicationScoped
public class IdentityDirectoryProducer {

    private static final Logger LOG = Logger.getLogger(IdentityDirectoryProducer.class);

    private final AuthConfig config;
    private final Vertx vertx;

    @Inject
    public IdentityDirectoryProducer(AuthConfig config, Vertx vertx) {
        this.config = config;
        this.vertx = vertx;
    }

    @Produces
    @ApplicationScoped
    public IdentityDirectory identityDirectory() {
        final var directory = config.directory();
        if (directory.mode() == AuthConfig.Directory.Mode.remote) {
            final var url = directory.url()
                    .filter(value -> !value.isBlank())
                    .orElseThrow(() -> new IllegalStateException(
                            "beacon.auth.directory.url is required when the directory mode is remote"));
            LOG.infov("Resolving identities through remote directory {0}", url);
            return new RemoteIdentityDirectory(WebClient.create(vertx), url, directory.timeout());
        }

        LOG.info("Resolving identities from token claims");
        return new ClaimsIdentityDirectory(config.claims());
    }
}
