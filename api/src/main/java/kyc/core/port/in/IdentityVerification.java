package kyc.core.port.in;

import io.smallrye.mutiny.Uni;

import kyc.core.model.AuthorizationRequest;
import kyc.core.model.CallbackRequest;
import kyc.core.model.KycStatusReport;
import kyc.core.model.VerificationResult;

/**
 * Inbound port for digital identity verification.
 *
 * <p>A verification attempt starts with {@link #initiate}, leaves the application
 * through a browser redirect to the identity provider, and ends when the provider
 * redirects back and {@link #handleCallback} runs the callback state machine.
 */
public interface IdentityVerification {

    /**
     * Start a verification attempt for a user.
     *
     * <p>Generates a fresh state, nonce and PKCE pair, persists the session, and
     * builds the provider authorization URL.
     *
     * @param userId the user being verified
     * @return the authorization URL and the attempt's state
     */
    Uni<AuthorizationRequest> initiate(String userId);

    /**
     * Complete a verification attempt from the provider's redirect.
     *
     * <p>Never fails: every error ends in a {@link VerificationResult.Failed}.
     *
     * @param callback callback query parameters
     * @return terminal result of the attempt
     */
    Uni<VerificationResult> handleCallback(CallbackRequest callback);

    /**
     * Report a user's current KYC standing.
     *
     * @param userId the user
     * @return status report
     */
    Uni<KycStatusReport> status(String userId);
}
