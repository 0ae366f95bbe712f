package kyc.core.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.VerificationJwkSelector;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.InvalidAlgorithmException;
import org.jose4j.lang.JoseException;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.port.out.JwksCache;

/**
 * Verifies JWTs signed by the identity provider against its published JWKS.
 *
 * <p>Used for both the ID token and the signed userinfo response. Only
 * asymmetric signature algorithms are accepted. When the token's {@code kid}
 * is not in the cached key set, the set is refreshed once (key rotation). A
 * token without a {@code kid} is tried against every compatible signing key.
 */
@ApplicationScoped
public class ProviderJwtVerifier {

    private static final Logger LOG = Logger.getLogger(ProviderJwtVerifier.class);
    static final int CLOCK_SKEW_SECONDS = 30;

    private static final AlgorithmConstraints ASYMMETRIC_ONLY = new AlgorithmConstraints(
            AlgorithmConstraints.ConstraintType.PERMIT,
            AlgorithmIdentifiers.RSA_USING_SHA256,
            AlgorithmIdentifiers.RSA_USING_SHA384,
            AlgorithmIdentifiers.RSA_USING_SHA512,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA256,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA384,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA512,
            AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256,
            AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384,
            AlgorithmIdentifiers.ECDSA_USING_P521_CURVE_AND_SHA512);

    private static final VerificationJwkSelector KEY_SELECTOR = new VerificationJwkSelector();

    private final JwksCache jwksCache;
    private final IdentityProviderConfig config;

    @Inject
    public ProviderJwtVerifier(JwksCache jwksCache, IdentityProviderConfig config) {
        this.jwksCache = jwksCache;
        this.config = config;
    }

    /**
     * What a verified token must satisfy beyond its signature.
     *
     * @param issuer   expected {@code iss}
     * @param audience value {@code aud} must contain
     * @param required whether {@code iss}, {@code aud} and {@code exp} must be present;
     *                 when false they are only checked if the token carries them
     */
    public record Expectations(String issuer, String audience, boolean required) {

        public static Expectations required(String issuer, String audience) {
            return new Expectations(issuer, audience, true);
        }

        public static Expectations whenPresent(String issuer, String audience) {
            return new Expectations(issuer, audience, false);
        }
    }

    /**
     * Verify a compact JWS and return its claims.
     *
     * <p>Fails with {@link JwtRejectedException} when the token is malformed,
     * its key is unknown, or any check fails. JWKS transport failures surface as
     * {@link kyc.core.exception.TransientNetworkException}.
     */
    public Uni<JwtClaims> verify(String jwt, Expectations expectations) {
        if (jwt == null || jwt.isBlank()) {
            return Uni.createFrom().failure(new JwtRejectedException("Token is empty"));
        }
        final var token = jwt.trim();
        return Uni.createFrom()
                .item(() -> parse(token))
                .flatMap(this::resolveCandidates)
                .map(candidates -> processWithAny(token, candidates, expectations));
    }

    /**
     * Keys that may have signed {@code jws}, matched on kid, kty, use and alg.
     * The key set is refreshed only when the token names a kid the cached set
     * does not hold.
     */
    private Uni<List<JsonWebKey>> resolveCandidates(JsonWebSignature jws) {
        final var keyId = jws.getKeyIdHeaderValue();
        return jwksCache.getKeySet(config.jwksUri()).flatMap(keySet -> {
            final var cached = select(jws, keySet);
            if (!cached.isEmpty() || keyId == null) {
                return Uni.createFrom().item(cached);
            }
            LOG.infof("Key %s not in cached provider JWKS, refreshing", keyId);
            return jwksCache.refresh(config.jwksUri()).map(refreshed -> select(jws, refreshed));
        });
    }

    private static List<JsonWebKey> select(JsonWebSignature jws, JsonWebKeySet keySet) {
        try {
            return KEY_SELECTOR.selectList(jws, keySet.getJsonWebKeys());
        } catch (JoseException e) {
            throw new JwtRejectedException("Token header does not fit any provider key: " + e.getMessage(), e);
        }
    }

    private JwtClaims processWithAny(String token, List<JsonWebKey> candidates, Expectations expectations) {
        if (candidates.isEmpty()) {
            throw new JwtRejectedException("Signing key not found in provider JWKS");
        }
        InvalidJwtException lastSignatureFailure = null;
        for (final var candidate : candidates) {
            try {
                return process(token, candidate, expectations);
            } catch (InvalidJwtException e) {
                if (!e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || candidates.size() == 1) {
                    LOG.debugf("Provider JWT rejected: %s", e.getMessage());
                    throw new JwtRejectedException(summarize(e), e);
                }
                lastSignatureFailure = e;
            }
        }
        LOG.debugf("No provider key among %d candidates verified the token", candidates.size());
        throw new JwtRejectedException(summarize(lastSignatureFailure), lastSignatureFailure);
    }

    private JwtClaims process(String token, JsonWebKey key, Expectations expectations) throws InvalidJwtException {
        final var builder = new JwtConsumerBuilder()
                .setRequireSubject()
                .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                .setJwsAlgorithmConstraints(ASYMMETRIC_ONLY)
                .setExpectedIssuer(expectations.required(), expectations.issuer())
                .setExpectedAudience(expectations.required(), expectations.audience())
                .setVerificationKey(key.getKey());
        if (expectations.required()) {
            builder.setRequireExpirationTime();
        }
        return builder.build().processToClaims(token);
    }

    private static JsonWebSignature parse(String token) {
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            return jws;
        } catch (JoseException e) {
            throw new JwtRejectedException("Token is not a compact JWS: " + e.getMessage(), e);
        }
    }

    static String summarize(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            return "Invalid token issuer";
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)) {
            return "Invalid token audience";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "Invalid token signature";
        }
        if (e.getCause() instanceof InvalidAlgorithmException) {
            return "Token signature algorithm not allowed";
        }
        return "Token validation failed";
    }

    /**
     * A provider JWT failed parsing, key lookup or claim validation.
     */
    public static class JwtRejectedException extends RuntimeException {
        public JwtRejectedException(String message) {
            super(message);
        }

        public JwtRejectedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
