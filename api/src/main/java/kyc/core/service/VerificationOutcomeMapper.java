package kyc.core.service;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kyc.core.exception.PersistenceException;
import kyc.core.exception.VerificationException;
import kyc.core.model.IdentityProfile;
import kyc.core.model.KycStatus;
import kyc.core.model.PersonalInfo;
import kyc.core.model.VerificationOutcome;
import kyc.core.port.out.UserVerificationRecords;

/**
 * Turns a verified identity profile into a {@code VERIFIED} outcome and records it
 * against the user who started the attempt.
 */
@ApplicationScoped
public class VerificationOutcomeMapper {

    private static final Logger LOG = Logger.getLogger(VerificationOutcomeMapper.class);

    private final UserVerificationRecords records;
    private final Clock clock;

    @Inject
    public VerificationOutcomeMapper(UserVerificationRecords records) {
        this(records, Clock.systemUTC());
    }

    VerificationOutcomeMapper(UserVerificationRecords records, Clock clock) {
        this.records = records;
        this.clock = clock;
    }

    public VerificationOutcome map(IdentityProfile profile) {
        return new VerificationOutcome(
                profile.subjectId(),
                PersonalInfo.from(profile),
                KycStatus.VERIFIED,
                clock.instant(),
                profile.rawClaims());
    }

    /**
     * Map and persist. Re-applying the same identity to the same user is a no-op
     * for the identity link; an identity linked to another user fails with
     * {@link kyc.core.exception.IdentityLinkConflictException}.
     */
    public Uni<VerificationOutcome> persist(String userId, IdentityProfile profile) {
        return Uni.createFrom()
                .item(() -> map(profile))
                .flatMap(outcome -> records.apply(userId, outcome)
                        .invoke(record -> LOG.infof("User %s verified, kycStatus=%s", userId, record.kycStatus()))
                        .replaceWith(outcome))
                .onFailure(error -> !(error instanceof VerificationException))
                .transform(error -> new PersistenceException(
                        "Failed to record verification outcome: " + error.getMessage(), error));
    }
}
