package kyc.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import kyc.core.model.VerificationSession;

/**
 * Storage for verification sessions.
 *
 * <p>Sessions are short-lived (typically 10 minutes) and cross a browser
 * redirect, so they must live outside the request that created them.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Sessions MUST expire automatically at {@link VerificationSession#expiresAt()}</li>
 *   <li>An existing state MUST NOT be overwritten</li>
 *   <li>Consumption MUST be atomic: of two concurrent takes, exactly one sees the session</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 */
public interface VerificationSessionRepository {

    /**
     * Store a session until its expiry.
     *
     * @param session the session to store
     * @return Uni completing when stored, failing with
     *     {@link kyc.core.exception.DuplicateStateException} when the state is taken
     */
    Uni<Void> put(VerificationSession session);

    /**
     * Retrieve and delete a session in one step (at-most-once consumption).
     *
     * @param state the state returned on the callback
     * @return Uni with the session, empty if not found, expired, or already consumed
     */
    Uni<Optional<VerificationSession>> takeByState(String state);
}
