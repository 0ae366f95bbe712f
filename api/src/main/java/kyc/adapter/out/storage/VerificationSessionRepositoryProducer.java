package kyc.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import kyc.core.port.out.VerificationSessionRepository;
import kyc.core.service.VerificationSessionStorageProviderRegistry;

/**
 * CDI producer for the verification session repository of the selected storage provider.
 *
 * @see kyc.spi.VerificationSessionStorageProvider
 */
@ApplicationScoped
public class VerificationSessionRepositoryProducer {

    private final VerificationSessionStorageProviderRegistry registry;

    @Inject
    public VerificationSessionRepositoryProducer(VerificationSessionStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public VerificationSessionRepository verificationSessionRepository() {
        return registry.getRepository();
    }
}
