package kyc.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Correlation data for one verification attempt, kept across the browser redirect.
 *
 * <p>Created when an authorization URL is issued and consumed exactly once by the
 * callback. A session is never reused: a retry starts a new attempt with a new
 * state, nonce and PKCE pair.
 *
 * @param state               opaque correlation key, unique per attempt
 * @param nonce               value the provider binds into the ID token
 * @param codeVerifier        PKCE verifier, sent only at code exchange
 * @param codeChallenge       PKCE challenge sent in the authorization request
 * @param codeChallengeMethod PKCE method ({@code S256})
 * @param userId              user who started the attempt
 * @param createdAt           when the authorization URL was issued
 * @param expiresAt           end of the validity window
 */
public record VerificationSession(
        String state,
        String nonce,
        String codeVerifier,
        String codeChallenge,
        String codeChallengeMethod,
        String userId,
        Instant createdAt,
        Instant expiresAt) {

    public VerificationSession {
        if (state == null || state.isBlank()) {
            throw new IllegalArgumentException("state is required");
        }
        if (nonce == null || nonce.isBlank()) {
            throw new IllegalArgumentException("nonce is required");
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new IllegalArgumentException("codeVerifier is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    /**
     * Create a session from freshly generated values.
     */
    public static VerificationSession create(
            String state, String nonce, PkcePair pkce, String userId, Instant now, Duration ttl) {
        return new VerificationSession(
                state,
                nonce,
                pkce.codeVerifier(),
                pkce.codeChallenge(),
                pkce.codeChallengeMethod(),
                userId,
                now,
                now.plus(ttl));
    }

    /**
     * Check whether the session is outside its validity window.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
