package beacon.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import beacon.core.model.event.BrokerError;
import beacon.core.model.event.BrokerException;

/**
 * Maps broker exceptions raised by REST resources to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapBrokerException(BrokerException e) {
        LOG.debugv("Broker error {0}: {1}", e.getError(), e.getMessage());
        return toResponse(toProblem(e));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(BrokerProblem.badRequest(e.getMessage()));
    }

    static HttpProblem toProblem(BrokerException e) {
        final BrokerError error = e.getError();
        if (error == BrokerError.FORBIDDEN) {
            return BrokerProblem.forbidden(e.getMessage());
        }
        if (error == BrokerError.UNAUTHENTICATED || error == BrokerError.AUTHENTICATION_REQUIRED) {
            return BrokerProblem.unauthorized(e.getMessage());
        }
        if (error == BrokerError.IDENTITY_NOT_FOUND) {
            return BrokerProblem.notFound(e.getMessage());
        }
        if (error == BrokerError.INTERNAL_ERROR) {
            return BrokerProblem.internalError(e.getMessage());
        }
        return BrokerProblem.badRequest(e.getMessage());
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
