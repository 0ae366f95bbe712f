package kyc.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Current KYC standing of a user.
 *
 * @param userId            the user
 * @param status            effective status, {@code EXPIRED} once the validity period passed
 * @param externalSubjectId linked provider subject
 * @param verifiedAt        when the user was last verified
 * @param expiresAt         when the current verification stops being honoured
 */
public record KycStatusReport(
        String userId,
        KycStatus status,
        Optional<String> externalSubjectId,
        Optional<Instant> verifiedAt,
        Optional<Instant> expiresAt) {

    public static KycStatusReport pending(String userId) {
        return new KycStatusReport(userId, KycStatus.PENDING, Optional.empty(), Optional.empty(), Optional.empty());
    }
}
