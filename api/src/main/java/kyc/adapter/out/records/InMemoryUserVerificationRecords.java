package kyc.adapter.out.records;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kyc.core.exception.IdentityLinkConflictException;
import kyc.core.model.UserVerificationRecord;
import kyc.core.model.VerificationOutcome;
import kyc.core.port.out.UserVerificationRecords;

/**
 * Reference user record store kept in memory.
 *
 * <p>Each external identity links to at most one user. Applying the same
 * identity to the same user again replaces that user's record and keeps the
 * single link; applying it to a different user is rejected.
 */
@ApplicationScoped
public class InMemoryUserVerificationRecords implements UserVerificationRecords {

    private static final Logger LOG = Logger.getLogger(InMemoryUserVerificationRecords.class);

    private final Map<String, UserVerificationRecord> recordsByUser = new HashMap<>();
    private final Map<String, String> userBySubject = new HashMap<>();

    @Override
    public Uni<UserVerificationRecord> apply(String userId, VerificationOutcome outcome) {
        return Uni.createFrom().item(() -> store(userId, outcome));
    }

    @Override
    public Uni<Optional<UserVerificationRecord>> find(String userId) {
        return Uni.createFrom().item(() -> lookup(userId));
    }

    /**
     * Number of identities linked to users.
     */
    public synchronized int linkCount() {
        return userBySubject.size();
    }

    private synchronized UserVerificationRecord store(String userId, VerificationOutcome outcome) {
        final var subject = outcome.externalSubjectId();
        final var linkedUser = userBySubject.get(subject);
        if (linkedUser != null && !linkedUser.equals(userId)) {
            LOG.warnf("Identity already linked to user %s, rejecting link to user %s", linkedUser, userId);
            throw new IdentityLinkConflictException(subject);
        }

        final var previous = recordsByUser.get(userId);
        if (previous != null
                && previous.externalSubjectId() != null
                && !previous.externalSubjectId().equals(subject)) {
            userBySubject.remove(previous.externalSubjectId());
        }

        final var record = UserVerificationRecord.of(userId, outcome);
        recordsByUser.put(userId, record);
        userBySubject.put(subject, userId);
        return record;
    }

    private synchronized Optional<UserVerificationRecord> lookup(String userId) {
        return Optional.ofNullable(recordsByUser.get(userId));
    }
}
