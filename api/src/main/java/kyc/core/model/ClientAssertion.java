package kyc.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Signed JWT asserting the application's identity to the token endpoint.
 *
 * <p>Built per token request and discarded afterwards.
 *
 * @param issuer     {@code iss}, the client ID
 * @param subject    {@code sub}, the client ID
 * @param audience   {@code aud}, the token endpoint
 * @param issuedAt   {@code iat}
 * @param expiresAt  {@code exp}
 * @param jwtId      {@code jti}
 * @param algorithm  JWS algorithm used to sign
 * @param keyId      {@code kid} header, if any
 * @param serialized compact serialization sent as {@code client_assertion}
 */
public record ClientAssertion(
        String issuer,
        String subject,
        String audience,
        Instant issuedAt,
        Instant expiresAt,
        String jwtId,
        String algorithm,
        Optional<String> keyId,
        String serialized) {

    public ClientAssertion {
        if (keyId == null) {
            keyId = Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "ClientAssertion[iss=" + issuer + ", aud=" + audience + ", jti=" + jwtId + ", exp=" + expiresAt + "]";
    }
}
