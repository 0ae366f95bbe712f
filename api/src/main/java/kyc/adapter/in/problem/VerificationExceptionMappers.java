package kyc.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import kyc.core.exception.PersistenceException;
import kyc.core.exception.TransientNetworkException;
import kyc.core.exception.VerificationException;

/**
 * Maps exceptions escaping the verification endpoints to Problem Details.
 *
 * <p>Callback failures never reach these mappers; they are returned as
 * results and converted by {@link VerificationProblem#callbackFailed}.
 */
@ApplicationScoped
public class VerificationExceptionMappers {

    private static final Logger LOG = Logger.getLogger(VerificationExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugf("Validation error: %s", e.getMessage());
        return toResponse(VerificationProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapTransientNetworkException(TransientNetworkException e) {
        LOG.warnf("Transient failure: %s", e.getMessage());
        return toResponse(VerificationProblem.serviceUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapPersistenceException(PersistenceException e) {
        LOG.errorf(e, "Verification storage failure");
        return toResponse(VerificationProblem.serviceUnavailable("Verification storage is unavailable"));
    }

    @ServerExceptionMapper
    public Response mapVerificationException(VerificationException e) {
        LOG.errorf(e, "Verification error");
        return toResponse(VerificationProblem.internalError("Identity verification could not be started"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
