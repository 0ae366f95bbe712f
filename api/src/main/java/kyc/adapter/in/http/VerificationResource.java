package kyc.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kyc.adapter.in.dto.AuthorizationResponseDto;
import kyc.adapter.in.dto.CallbackResultDto;
import kyc.adapter.in.dto.KycStatusDto;
import kyc.adapter.in.problem.VerificationProblem;
import kyc.core.model.CallbackRequest;
import kyc.core.model.VerificationResult;
import kyc.core.port.in.IdentityVerification;

/**
 * HTTP surface of identity verification.
 *
 * <p>{@code /authorize} and {@code /status} act for the user named by the
 * {@value #USER_HEADER} header, which the fronting application sets after
 * authenticating the request. {@code /callback} is reached by browser
 * redirect from the provider and identifies the user through the session
 * bound to {@code state}.
 */
@Path("/kyc")
@Produces(MediaType.APPLICATION_JSON)
public class VerificationResource {

    private static final Logger LOG = Logger.getLogger(VerificationResource.class);
    static final String USER_HEADER = "X-User-Id";

    private final IdentityVerification identityVerification;

    @Inject
    public VerificationResource(IdentityVerification identityVerification) {
        this.identityVerification = identityVerification;
    }

    /**
     * Start a verification attempt.
     *
     * @param userId user from {@value #USER_HEADER}
     * @return authorization URL, state and session expiry
     */
    @GET
    @Path("/authorize")
    public Uni<AuthorizationResponseDto> authorize(@HeaderParam(USER_HEADER) String userId) {
        requireUser(userId);
        return identityVerification.initiate(userId).map(AuthorizationResponseDto::from);
    }

    @GET
    @Path("/callback")
    public Uni<CallbackResultDto> callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error,
            @QueryParam("error_description") String errorDescription) {
        return handle(CallbackRequest.of(code, state, error, errorDescription));
    }

    /**
     * Callback delivered with {@code response_mode=form_post}.
     */
    @POST
    @Path("/callback")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<CallbackResultDto> callbackForm(
            @FormParam("code") String code,
            @FormParam("state") String state,
            @FormParam("error") String error,
            @FormParam("error_description") String errorDescription) {
        return handle(CallbackRequest.of(code, state, error, errorDescription));
    }

    @GET
    @Path("/status")
    public Uni<KycStatusDto> status(@HeaderParam(USER_HEADER) String userId) {
        requireUser(userId);
        return identityVerification.status(userId).map(KycStatusDto::from);
    }

    private Uni<CallbackResultDto> handle(CallbackRequest callback) {
        return identityVerification.handleCallback(callback).map(result -> {
            if (result instanceof VerificationResult.Completed completed) {
                return CallbackResultDto.from(completed);
            }
            final var failed = (VerificationResult.Failed) result;
            LOG.debugf("Callback failed with %s", failed.reason());
            throw VerificationProblem.callbackFailed(failed);
        });
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw VerificationProblem.missingUser();
        }
    }
}
