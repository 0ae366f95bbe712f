package kyc.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable result of a verification, written onto the owning user record.
 *
 * @param externalSubjectId provider's stable identifier for the person
 * @param personalInfo      normalized attributes
 * @param status            resulting KYC status
 * @param verifiedAt        when the verification completed
 * @param rawClaims         full claim set kept for audit
 */
public record VerificationOutcome(
        String externalSubjectId,
        PersonalInfo personalInfo,
        KycStatus status,
        Instant verifiedAt,
        Map<String, Object> rawClaims) {

    public VerificationOutcome {
        if (externalSubjectId == null || externalSubjectId.isBlank()) {
            throw new IllegalArgumentException("externalSubjectId is required");
        }
        Objects.requireNonNull(personalInfo, "personalInfo is required");
        Objects.requireNonNull(status, "status is required");
        rawClaims = rawClaims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawClaims));
    }
}
