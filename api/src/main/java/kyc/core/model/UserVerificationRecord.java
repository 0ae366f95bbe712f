package kyc.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verification data held on a user record.
 *
 * @param userId            owning user
 * @param kycStatus         current KYC status
 * @param externalSubjectId linked provider subject, null when never verified
 * @param personalInfo      attributes from the last verification
 * @param verifiedAt        when the last verification completed
 * @param rawClaims         claims from the last verification
 */
public record UserVerificationRecord(
        String userId,
        KycStatus kycStatus,
        String externalSubjectId,
        PersonalInfo personalInfo,
        Instant verifiedAt,
        Map<String, Object> rawClaims) {

    public UserVerificationRecord {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (kycStatus == null) {
            kycStatus = KycStatus.PENDING;
        }
        rawClaims = rawClaims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawClaims));
    }

    /**
     * Record for a user that applied the given outcome.
     */
    public static UserVerificationRecord of(String userId, VerificationOutcome outcome) {
        return new UserVerificationRecord(
                userId,
                outcome.status(),
                outcome.externalSubjectId(),
                outcome.personalInfo(),
                outcome.verifiedAt(),
                outcome.rawClaims());
    }
}
