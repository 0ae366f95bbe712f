package kyc.core.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import kyc.core.config.VerificationSessionConfig;
import kyc.core.port.out.VerificationSessionRepository;
import kyc.spi.VerificationSessionStorageProvider;

/**
 * Discovers session storage providers via CDI and selects one.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider ({@code kyc.session.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class VerificationSessionStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(VerificationSessionStorageProviderRegistry.class);

    private final Iterable<VerificationSessionStorageProvider> providers;
    private final VerificationSessionConfig config;

    private volatile VerificationSessionStorageProvider selectedProvider;
    private volatile VerificationSessionRepository repository;

    @Inject
    public VerificationSessionStorageProviderRegistry(
            Instance<VerificationSessionStorageProvider> providers, VerificationSessionConfig config) {
        this((Iterable<VerificationSessionStorageProvider>) providers, config);
    }

    VerificationSessionStorageProviderRegistry(
            Iterable<VerificationSessionStorageProvider> providers, VerificationSessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    public synchronized VerificationSessionRepository getRepository() {
        if (repository == null) {
            repository = getSelectedProvider().createRepository();
        }
        return repository;
    }

    public synchronized VerificationSessionStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    /**
     * Providers currently reporting themselves available.
     */
    public List<VerificationSessionStorageProvider> getAvailableProviders() {
        final var available = new ArrayList<VerificationSessionStorageProvider>();
        for (VerificationSessionStorageProvider provider : providers) {
            if (provider.isAvailable()) {
                available.add(provider);
            }
        }
        available.sort(Comparator.comparingInt(VerificationSessionStorageProvider::priority)
                .reversed());
        return available;
    }

    private VerificationSessionStorageProvider selectProvider() {
        final var configuredProvider = config.storage().provider();
        final var availableProviders = getAvailableProviders();

        LOG.debugf(
                "Available session storage providers: %s",
                availableProviders.stream()
                        .map(VerificationSessionStorageProvider::name)
                        .toList());

        Optional<VerificationSessionStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.infof("Using configured session storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured session storage provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using session storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No session storage providers available");
    }
}
