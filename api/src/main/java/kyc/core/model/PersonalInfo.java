package kyc.core.model;

/**
 * Normalized personal attributes stored on a verified user.
 *
 * <p>Any field may be null when the provider did not release the claim.
 * {@code address} is kept as the provider's formatted representation.
 */
public record PersonalInfo(
        String firstName,
        String lastName,
        String email,
        String phone,
        String birthdate,
        String gender,
        String address,
        String pictureRef) {

    public static PersonalInfo from(IdentityProfile profile) {
        return new PersonalInfo(
                profile.givenName(),
                profile.familyName(),
                profile.email(),
                profile.phone(),
                profile.birthdate(),
                profile.gender(),
                profile.address(),
                profile.pictureRef());
    }
}
