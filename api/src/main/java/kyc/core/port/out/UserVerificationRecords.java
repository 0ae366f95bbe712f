package kyc.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import kyc.core.model.UserVerificationRecord;
import kyc.core.model.VerificationOutcome;

/**
 * The user-record store that receives verification outcomes.
 *
 * <p>Owned by the surrounding application. A user has at most one current
 * outcome; a new successful verification overwrites the previous one.
 */
public interface UserVerificationRecords {

    /**
     * Write an outcome onto a user's record.
     *
     * <p>Must be idempotent: applying an outcome for the same
     * {@code externalSubjectId} twice leaves exactly one identity link. A subject
     * already linked to another user fails with
     * {@link kyc.core.exception.IdentityLinkConflictException}.
     *
     * @param userId  owning user
     * @param outcome outcome to apply
     * @return the updated record
     */
    Uni<UserVerificationRecord> apply(String userId, VerificationOutcome outcome);

    /**
     * Look up a user's verification record.
     *
     * @param userId the user
     * @return the record, empty when the user was never verified
     */
    Uni<Optional<UserVerificationRecord>> find(String userId);
}
