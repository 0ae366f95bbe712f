package kyc.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Profile resolved from the provider's signed userinfo document.
 *
 * @param subjectId  provider subject identifier
 * @param givenName  given name
 * @param familyName family name
 * @param email      email address
 * @param phone      phone number
 * @param birthdate  date of birth as released by the provider
 * @param gender     gender
 * @param address    address, formatted
 * @param pictureRef photo reference (URL or data URI)
 * @param rawClaims  the complete decoded claim set
 */
public record IdentityProfile(
        String subjectId,
        String givenName,
        String familyName,
        String email,
        String phone,
        String birthdate,
        String gender,
        String address,
        String pictureRef,
        Map<String, Object> rawClaims) {

    public IdentityProfile {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId is required");
        }
        rawClaims = rawClaims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawClaims));
    }
}
