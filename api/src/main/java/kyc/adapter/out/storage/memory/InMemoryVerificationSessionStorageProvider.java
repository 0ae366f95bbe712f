package kyc.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import kyc.core.port.out.VerificationSessionRepository;
import kyc.spi.VerificationSessionStorageProvider;

/**
 * Keeps verification sessions in this JVM.
 *
 * <p>Selected when nothing else is configured or reachable. A callback only
 * finds its session on the instance that issued the authorization URL, so
 * more than one instance needs sticky routing or the Redis provider.
 */
@ApplicationScoped
public class InMemoryVerificationSessionStorageProvider implements VerificationSessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryVerificationSessionStorageProvider.class);

    private final AtomicReference<InMemoryVerificationSessionRepository> sessions = new AtomicReference<>();

    @Override
    public String name() {
        return "memory";
    }

    /** Lowest; only chosen by name or when nothing else is reachable. */
    @Override
    public int priority() {
        return 0;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public VerificationSessionRepository createRepository() {
        final var existing = sessions.get();
        if (existing != null) {
            return existing;
        }
        final var created = new InMemoryVerificationSessionRepository();
        if (!sessions.compareAndSet(null, created)) {
            created.shutdown();
            return sessions.get();
        }
        LOG.warn(
                "Verification sessions are held in this instance only. Set kyc.session.storage.provider=redis"
                        + " when callbacks may reach another instance.");
        return created;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var repository = sessions.get();
        return Optional.of(HealthCheckResponse.named("kyc-session-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sharedAcrossInstances", false)
                .withData("sessions", repository == null ? 0 : repository.getSessionCount())
                .build());
    }

    @PreDestroy
    void shutdown() {
        final var repository = sessions.getAndSet(null);
        if (repository != null) {
            repository.shutdown();
        }
    }
}
