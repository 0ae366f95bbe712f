package kyc.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Claims of an ID token that passed signature, issuer, audience, expiry and nonce checks.
 *
 * @param subject   {@code sub}
 * @param issuer    {@code iss}
 * @param expiresAt {@code exp}
 * @param claims    all claims
 */
public record IdTokenClaims(String subject, String issuer, Instant expiresAt, Map<String, Object> claims) {

    public IdTokenClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }
}
