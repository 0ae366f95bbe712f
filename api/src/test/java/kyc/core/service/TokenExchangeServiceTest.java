package kyc.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import kyc.core.exception.AssertionBuildException;
import kyc.core.exception.TokenExchangeException;
import kyc.core.exception.TokenValidationException;
import kyc.core.model.PkcePair;
import kyc.core.model.TokenExchangeRequest;
import kyc.core.model.TokenResponse;
import kyc.core.model.VerificationSession;
import kyc.core.port.out.JwksCache;
import kyc.core.port.out.TokenEndpointClient;
import kyc.testing.ProviderKeys;
import kyc.testing.TestProviderConfig;

@DisplayName("TokenExchangeService")
@ExtendWith(MockitoExtension.class)
class TokenExchangeServiceTest {

    @Mock
    private TokenEndpointClient tokenEndpointClient;

    @Mock
    private JwksCache jwksCache;

    private TestProviderConfig config;
    private TokenExchangeService service;
    private VerificationSession session;

    @BeforeEach
    void setUp() {
        config = new TestProviderConfig().withSigningKey(ProviderKeys.clientKeyAsBase64Jwk());
        final var verifier = new ProviderJwtVerifier(jwksCache, config);
        service = new TokenExchangeService(
                tokenEndpointClient, new ClientAssertionSigner(config), new IdTokenValidator(verifier, config), config);
        session = VerificationSession.create(
                "state-1",
                "nonce-1",
                new PkcePair("verifier-1", "challenge-1", "S256"),
                "user-1",
                Instant.now(),
                Duration.ofMinutes(10));

        lenient()
                .when(jwksCache.getKeySet(TestProviderConfig.JWKS_URI))
                .thenReturn(Uni.createFrom().item(ProviderKeys.providerKeySet()));
    }

    private static TokenResponse tokens(Optional<String> idToken) {
        return new TokenResponse("access-1", "Bearer", 300, Optional.empty(), idToken);
    }

    @Test
    @DisplayName("should send code, verifier and a signed assertion")
    void shouldBuildRequest() {
        final var idToken = ProviderKeys.sign(ProviderKeys.idTokenClaims("fayda-123", "nonce-1"));
        when(tokenEndpointClient.exchange(any())).thenReturn(Uni.createFrom().item(tokens(Optional.of(idToken))));

        final var result = service.exchange("code-1", session).await().atMost(Duration.ofSeconds(2));

        final var captor = ArgumentCaptor.forClass(TokenExchangeRequest.class);
        verify(tokenEndpointClient).exchange(captor.capture());
        final var request = captor.getValue();
        assertEquals("code-1", request.authorizationCode());
        assertEquals("verifier-1", request.codeVerifier());
        assertEquals(TestProviderConfig.TOKEN_ENDPOINT, request.tokenEndpoint());
        assertEquals(TestProviderConfig.TOKEN_ENDPOINT, request.clientAssertion().audience());
        assertEquals(config.assertionType, request.clientAssertionType());
        assertEquals("fayda-123", result.idToken().subject());
        assertEquals("access-1", result.tokens().accessToken());
    }

    @Test
    @DisplayName("should fail when the token response has no id_token")
    void shouldRequireIdToken() {
        when(tokenEndpointClient.exchange(any())).thenReturn(Uni.createFrom().item(tokens(Optional.empty())));

        assertThrows(TokenValidationException.class, () -> service.exchange("code-1", session)
                .await()
                .atMost(Duration.ofSeconds(2)));
    }

    @Test
    @DisplayName("should fail when the ID token nonce is not the session nonce")
    void shouldRejectForeignNonce() {
        final var idToken = ProviderKeys.sign(ProviderKeys.idTokenClaims("fayda-123", "other-nonce"));
        when(tokenEndpointClient.exchange(any())).thenReturn(Uni.createFrom().item(tokens(Optional.of(idToken))));

        assertThrows(TokenValidationException.class, () -> service.exchange("code-1", session)
                .await()
                .atMost(Duration.ofSeconds(2)));
    }

    @Test
    @DisplayName("should pass provider errors through")
    void shouldPropagateProviderErrors() {
        when(tokenEndpointClient.exchange(any()))
                .thenReturn(Uni.createFrom().failure(new TokenExchangeException("rejected", 400, "invalid_grant", null)));

        final var error = assertThrows(TokenExchangeException.class, () -> service.exchange("code-1", session)
                .await()
                .atMost(Duration.ofSeconds(2)));

        assertEquals(Optional.of("invalid_grant"), error.providerError());
    }

    @Test
    @DisplayName("should not call the token endpoint when the assertion cannot be built")
    void shouldFailBeforeNetworkOnAssertionError() {
        config.clientId = "";

        assertThrows(AssertionBuildException.class, () -> service.exchange("code-1", session)
                .await()
                .atMost(Duration.ofSeconds(2)));
        verify(tokenEndpointClient, never()).exchange(any());
    }
}
