package kyc.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kyc.core.exception.DuplicateStateException;
import kyc.core.model.VerificationSession;
import kyc.core.port.out.VerificationSessionRepository;

/**
 * In-memory verification session storage.
 *
 * <p>For development and single-instance deployments: sessions are lost on
 * restart and not shared across instances. {@link #takeByState} relies on
 * {@link ConcurrentMap#remove(Object)}, so of two racing callbacks only one
 * receives the session.
 */
public class InMemoryVerificationSessionRepository implements VerificationSessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryVerificationSessionRepository.class);

    private final ConcurrentMap<String, VerificationSession> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryVerificationSessionRepository() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "kyc-session-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory verification session repository");
    }

    @Override
    public Uni<Void> put(VerificationSession session) {
        return Uni.createFrom().item(() -> {
            final var existing = sessions.putIfAbsent(session.state(), session);
            if (existing != null) {
                throw new DuplicateStateException("A verification session already exists for this state");
            }
            LOG.debugf("Stored verification session for user %s, expires %s", session.userId(), session.expiresAt());
            return null;
        });
    }

    @Override
    public Uni<Optional<VerificationSession>> takeByState(String state) {
        return Uni.createFrom().item(() -> {
            final var session = sessions.remove(state);
            if (session == null) {
                LOG.debug("No verification session found for state");
                return Optional.<VerificationSession>empty();
            }
            if (session.isExpired(Instant.now())) {
                LOG.debugf("Verification session for user %s expired at %s", session.userId(), session.expiresAt());
                return Optional.<VerificationSession>empty();
            }
            return Optional.of(session);
        });
    }

    void cleanupExpired() {
        final var now = Instant.now();
        final var before = sessions.size();

        sessions.values().removeIf(session -> session.isExpired(now));

        final var removed = before - sessions.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired verification sessions", removed);
        }
    }

    /**
     * Stops the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Number of stored sessions, expired ones included until cleanup runs.
     */
    public int getSessionCount() {
        return sessions.size();
    }
}
