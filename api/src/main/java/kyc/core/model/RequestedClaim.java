package kyc.core.model;

/**
 * A userinfo claim named in the authorization request.
 *
 * @param name      claim name, e.g. {@code phone_number}
 * @param essential whether the provider must release it
 */
public record RequestedClaim(String name, boolean essential) {

    public RequestedClaim {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Claim name is required");
        }
    }
}
