package kyc.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import kyc.core.exception.TokenValidationException;
import kyc.core.exception.TransientNetworkException;
import kyc.core.port.out.JwksCache;
import kyc.testing.ProviderKeys;
import kyc.testing.TestProviderConfig;

@DisplayName("IdTokenValidator")
@ExtendWith(MockitoExtension.class)
class IdTokenValidatorTest {

    @Mock
    private JwksCache jwksCache;

    private IdTokenValidator validator;

    @BeforeEach
    void setUp() {
        final var config = new TestProviderConfig();
        validator = new IdTokenValidator(new ProviderJwtVerifier(jwksCache, config), config);
        lenient()
                .when(jwksCache.getKeySet(TestProviderConfig.JWKS_URI))
                .thenReturn(Uni.createFrom().item(ProviderKeys.providerKeySet()));
    }

    @Test
    @DisplayName("should return subject and expiry of a valid ID token")
    void shouldAcceptValidToken() {
        final var token = ProviderKeys.sign(ProviderKeys.idTokenClaims("fayda-123", "nonce-1"));

        final var claims = validator.validate(token, "nonce-1").await().atMost(Duration.ofSeconds(1));

        assertEquals("fayda-123", claims.subject());
        assertEquals(TestProviderConfig.ISSUER, claims.issuer());
        assertEquals("nonce-1", claims.claims().get("nonce"));
    }

    @Test
    @DisplayName("should reject a nonce from another session")
    void shouldRejectNonceMismatch() {
        final var token = ProviderKeys.sign(ProviderKeys.idTokenClaims("fayda-123", "nonce-1"));

        assertThrows(TokenValidationException.class, () -> validator.validate(token, "nonce-2")
                .await()
                .atMost(Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("should reject a token without nonce")
    void shouldRejectMissingNonce() {
        final var claims = ProviderKeys.idTokenClaims("fayda-123", "nonce-1");
        claims.unsetClaim("nonce");
        final var token = ProviderKeys.sign(claims);

        assertThrows(TokenValidationException.class, () -> validator.validate(token, "nonce-1")
                .await()
                .atMost(Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("should wrap signature failures in TokenValidationException")
    void shouldWrapVerificationFailures() {
        final var token = ProviderKeys.sign(
                ProviderKeys.idTokenClaims("fayda-123", "nonce-1"), ProviderKeys.generate(ProviderKeys.PROVIDER_KEY_ID));

        final var error = assertThrows(TokenValidationException.class, () -> validator.validate(token, "nonce-1")
                .await()
                .atMost(Duration.ofSeconds(1)));

        assertEquals(ProviderJwtVerifier.JwtRejectedException.class, error.getCause().getClass());
    }

    @Test
    @DisplayName("should keep transient JWKS failures retryable")
    void shouldKeepTransientFailures() {
        lenient()
                .when(jwksCache.getKeySet(TestProviderConfig.JWKS_URI))
                .thenReturn(Uni.createFrom().failure(new TransientNetworkException("JWKS timeout")));
        final var token = ProviderKeys.sign(ProviderKeys.idTokenClaims("fayda-123", "nonce-1"));

        assertThrows(TransientNetworkException.class, () -> validator.validate(token, "nonce-1")
                .await()
                .atMost(Duration.ofSeconds(1)));
    }
}
