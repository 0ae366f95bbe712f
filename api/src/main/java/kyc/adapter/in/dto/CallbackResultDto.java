package kyc.adapter.in.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import kyc.core.model.VerificationResult;
import kyc.core.model.VerificationState;

/**
 * Body of a successful callback.
 */
public record CallbackResultDto(
        @JsonProperty("status") VerificationState status,
        @JsonProperty("user_id") String userId,
        @JsonProperty("kyc_status") String kycStatus,
        @JsonProperty("external_subject_id") String externalSubjectId,
        @JsonProperty("verified_at") Instant verifiedAt,
        @JsonProperty("personal_info") PersonalInfoDto personalInfo,
        @JsonProperty("history") List<VerificationState> history) {

    public static CallbackResultDto from(VerificationResult.Completed completed) {
        final var outcome = completed.outcome();
        return new CallbackResultDto(
                completed.finalState(),
                completed.userId(),
                outcome.status().name(),
                outcome.externalSubjectId(),
                outcome.verifiedAt(),
                PersonalInfoDto.from(outcome.personalInfo()),
                completed.history());
    }
}
