package kyc.core.model;

import java.time.Instant;

/**
 * Result of starting a verification attempt.
 *
 * @param authorizationUrl URL the browser is sent to
 * @param state            correlation key of the attempt
 * @param expiresAt        when the attempt stops being accepted
 */
public record AuthorizationRequest(String authorizationUrl, String state, Instant expiresAt) {}
