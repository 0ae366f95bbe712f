package kyc.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import kyc.core.port.out.VerificationSessionRepository;

/**
 * SPI for verification session storage.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - shared storage for multi-instance deployments</li>
 *   <li>memory (priority: 0) - single instance, development and tests</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider ({@code kyc.session.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 *
 * <p>Custom providers are CDI beans implementing this interface, selected by
 * {@link #name()}:
 * <pre>
 * kyc.session.storage.provider=dynamodb
 * </pre>
 *
 * @see VerificationSessionRepository
 */
public interface VerificationSessionStorageProvider {

    /**
     * Name used in {@code kyc.session.storage.provider}.
     */
    String name();

    /**
     * Priority for automatic selection; higher is preferred.
     */
    int priority();

    /**
     * Whether the backend is reachable. Called during selection, so it must return quickly.
     */
    boolean isAvailable();

    /**
     * Create the repository. Implementations must expire sessions by TTL,
     * refuse to overwrite an existing state, and take sessions atomically.
     */
    VerificationSessionRepository createRepository();

    /**
     * Health of the storage backend, if the provider reports one.
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
