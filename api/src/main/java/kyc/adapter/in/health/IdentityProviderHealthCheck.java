package kyc.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import kyc.core.service.ClientAssertionSigner;
import kyc.core.service.PkceService;
import kyc.core.service.VerificationSessionStorageProviderRegistry;

/**
 * Readiness of the identity verification flow.
 *
 * <p>Down when the secure random source is unusable or the selected session
 * storage reports itself down. A missing signing key already fails startup.
 */
@Readiness
@ApplicationScoped
public class IdentityProviderHealthCheck implements HealthCheck {

    static final String NAME = "kyc-identity-provider";

    private final ClientAssertionSigner signer;
    private final PkceService pkceService;
    private final VerificationSessionStorageProviderRegistry storageRegistry;

    @Inject
    public IdentityProviderHealthCheck(
            ClientAssertionSigner signer,
            PkceService pkceService,
            VerificationSessionStorageProviderRegistry storageRegistry) {
        this.signer = signer;
        this.pkceService = pkceService;
        this.storageRegistry = storageRegistry;
    }

    @Override
    public HealthCheckResponse call() {
        final var entropyAvailable = pkceService.isEntropyAvailable();
        final var storage = storageRegistry.getSelectedProvider();
        final var storageUp = storage.healthCheck()
                .map(response -> response.getStatus() == HealthCheckResponse.Status.UP)
                .orElse(true);

        final var builder = HealthCheckResponse.named(NAME)
                .withData("signingKey", "loaded")
                .withData("algorithm", signer.algorithm())
                .withData("keyId", signer.keyId().orElse("none"))
                .withData("entropy", entropyAvailable ? "available" : "unavailable")
                .withData("sessionStorage", storage.name())
                .withData("sessionStorageUp", storageUp);

        return entropyAvailable && storageUp ? builder.up().build() : builder.down().build();
    }
}
