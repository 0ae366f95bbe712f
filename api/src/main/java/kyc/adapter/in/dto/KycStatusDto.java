package kyc.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import kyc.core.model.KycStatus;
import kyc.core.model.KycStatusReport;

/**
 * KYC status of a user.
 *
 * @param userId            the user
 * @param kycStatus         current status, {@code EXPIRED} once the verification validity has passed
 * @param verified          whether the user currently counts as verified
 * @param externalSubjectId linked provider identity, null when never verified
 * @param verifiedAt        time of the last verification
 * @param expiresAt         when the current verification stops being valid
 */
public record KycStatusDto(
        @JsonProperty("user_id") String userId,
        @JsonProperty("kyc_status") KycStatus kycStatus,
        @JsonProperty("verified") boolean verified,
        @JsonProperty("external_subject_id") String externalSubjectId,
        @JsonProperty("verified_at") Instant verifiedAt,
        @JsonProperty("expires_at") Instant expiresAt) {

    public static KycStatusDto from(KycStatusReport report) {
        return new KycStatusDto(
                report.userId(),
                report.status(),
                report.status() == KycStatus.VERIFIED,
                report.externalSubjectId().orElse(null),
                report.verifiedAt().orElse(null),
                report.expiresAt().orElse(null));
    }
}
