package kyc.core.service;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.AssertionBuildException;
import kyc.core.exception.ConfigurationException;
import kyc.core.model.ClientAssertion;

/**
 * Signs the JWT client assertion presented to the token endpoint ({@code private_key_jwt}).
 *
 * <p>The private key is loaded once at startup and never changes, so signing
 * needs no locking. A missing or unusable key fails startup with a
 * {@link ConfigurationException}. Each assertion carries:
 * <ul>
 *   <li>{@code iss} and {@code sub}: the client ID</li>
 *   <li>{@code aud}: the token endpoint</li>
 *   <li>{@code iat}, {@code exp}: a short validity window</li>
 *   <li>{@code jti}: a fresh random identifier</li>
 * </ul>
 */
@Startup
@ApplicationScoped
public class ClientAssertionSigner {

    private static final Logger LOG = Logger.getLogger(ClientAssertionSigner.class);
    static final Duration MAX_TTL = Duration.ofHours(2);

    private final IdentityProviderConfig config;
    private final Clock clock;
    private final PrivateKey signingKey;
    private final String algorithm;
    private final Optional<String> keyId;
    private final Duration ttl;

    @Inject
    public ClientAssertionSigner(IdentityProviderConfig config) {
        this(config, Clock.systemUTC());
    }

    ClientAssertionSigner(IdentityProviderConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        final var assertionConfig = config.clientAssertion();
        final var keyData = assertionConfig
                .signingKey()
                .orElseThrow(() ->
                        new ConfigurationException("kyc.provider.client-assertion.signing-key is not configured"));
        final var loaded = SigningKeys.parse(keyData);

        this.signingKey = loaded.privateKey();
        this.algorithm = SigningKeys.resolveAlgorithm(loaded.privateKey(), assertionConfig.algorithm());
        this.keyId = assertionConfig.keyId().or(loaded::keyId);
        this.ttl = assertionConfig.ttl();

        if (ttl.isNegative() || ttl.isZero() || ttl.compareTo(MAX_TTL) > 0) {
            throw new ConfigurationException("Client assertion TTL must be positive and at most " + MAX_TTL);
        }

        LOG.infof(
                "Client assertion signer initialized: algorithm=%s, keyId=%s, ttl=%s",
                algorithm, keyId.orElse("none"), ttl);
    }

    /**
     * Build and sign a new client assertion.
     *
     * @return the signed assertion
     * @throws AssertionBuildException if a required claim is missing or signing fails
     */
    public ClientAssertion sign() {
        final var clientId = requireClaim("iss", config.clientId());
        final var audience = requireClaim("aud", config.tokenEndpoint());
        final var issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final var expiresAt = issuedAt.plus(ttl);
        final var jwtId = UUID.randomUUID().toString();

        final var claims = new JwtClaims();
        claims.setIssuer(clientId);
        claims.setSubject(clientId);
        claims.setAudience(audience);
        claims.setIssuedAt(numericDate(issuedAt));
        claims.setExpirationTime(numericDate(expiresAt));
        claims.setJwtId(jwtId);

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(signingKey);
        jws.setAlgorithmHeaderValue(algorithm);
        jws.setHeader("typ", "JWT");
        keyId.ifPresent(jws::setKeyIdHeaderValue);

        try {
            final var serialized = jws.getCompactSerialization();
            LOG.debugf("Signed client assertion jti=%s, exp=%s", jwtId, expiresAt);
            return new ClientAssertion(
                    clientId, clientId, audience, issuedAt, expiresAt, jwtId, algorithm, keyId, serialized);
        } catch (JoseException e) {
            throw new AssertionBuildException("Failed to sign client assertion: " + e.getMessage(), e);
        }
    }

    public String algorithm() {
        return algorithm;
    }

    public Optional<String> keyId() {
        return keyId;
    }

    public Duration ttl() {
        return ttl;
    }

    private static String requireClaim(String claim, String value) {
        if (value == null || value.isBlank()) {
            throw new AssertionBuildException("Client assertion claim '" + claim + "' has no value");
        }
        return value;
    }

    private static NumericDate numericDate(Instant instant) {
        return NumericDate.fromSeconds(instant.getEpochSecond());
    }
}
