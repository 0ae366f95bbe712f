package kyc.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kyc.core.service.ClientAssertionSigner;
import kyc.core.service.PkceService;
import kyc.core.service.VerificationSessionStorageProviderRegistry;
import kyc.spi.VerificationSessionStorageProvider;

@DisplayName("IdentityProviderHealthCheck")
class IdentityProviderHealthCheckTest {

    private PkceService pkceService;
    private VerificationSessionStorageProvider storage;
    private IdentityProviderHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        final var signer = mock(ClientAssertionSigner.class);
        when(signer.algorithm()).thenReturn("RS256");
        when(signer.keyId()).thenReturn(Optional.of("client-key-1"));

        pkceService = mock(PkceService.class);
        when(pkceService.isEntropyAvailable()).thenReturn(true);

        storage = mock(VerificationSessionStorageProvider.class);
        when(storage.name()).thenReturn("redis");
        when(storage.healthCheck()).thenReturn(Optional.empty());

        final var registry = mock(VerificationSessionStorageProviderRegistry.class);
        when(registry.getSelectedProvider()).thenReturn(storage);

        healthCheck = new IdentityProviderHealthCheck(signer, pkceService, registry);
    }

    @Test
    @DisplayName("should be UP with key and storage details")
    void shouldBeUp() {
        final var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("kyc-identity-provider", response.getName());
        final var data = response.getData().orElseThrow();
        assertEquals("RS256", data.get("algorithm"));
        assertEquals("client-key-1", data.get("keyId"));
        assertEquals("redis", data.get("sessionStorage"));
    }

    @Test
    @DisplayName("should be DOWN without entropy")
    void shouldBeDownWithoutEntropy() {
        when(pkceService.isEntropyAvailable()).thenReturn(false);

        assertEquals(HealthCheckResponse.Status.DOWN, healthCheck.call().getStatus());
    }

    @Test
    @DisplayName("should be DOWN when session storage is down")
    void shouldBeDownWhenStorageDown() {
        when(storage.healthCheck())
                .thenReturn(Optional.of(HealthCheckResponse.named("kyc-session-storage-redis")
                        .down()
                        .build()));

        final var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals(false, response.getData().orElseThrow().get("sessionStorageUp"));
    }
}
