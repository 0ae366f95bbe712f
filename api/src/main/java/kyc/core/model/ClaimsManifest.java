package kyc.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit list of the profile attributes requested from the provider.
 *
 * <p>Rendered into the {@code claims} request parameter (OIDC Core 5.5). A claim
 * listed both as essential and voluntary is kept as essential.
 *
 * @param userinfo claims requested from the userinfo endpoint, in request order
 */
public record ClaimsManifest(List<RequestedClaim> userinfo) {

    public ClaimsManifest {
        userinfo = userinfo == null ? List.of() : List.copyOf(userinfo);
    }

    /**
     * Build a manifest from essential and voluntary claim names.
     */
    public static ClaimsManifest of(List<String> essential, List<String> voluntary) {
        final var claims = new LinkedHashMap<String, RequestedClaim>();
        for (String name : voluntary) {
            claims.put(name.trim(), new RequestedClaim(name.trim(), false));
        }
        for (String name : essential) {
            claims.put(name.trim(), new RequestedClaim(name.trim(), true));
        }
        return new ClaimsManifest(new ArrayList<>(claims.values()));
    }

    /**
     * Shape of the {@code claims} parameter:
     * {@code {"userinfo": {name: {"essential": bool}}, "id_token": {}}}.
     */
    public Map<String, Object> toRequestParameter() {
        final var userinfoClaims = new LinkedHashMap<String, Object>();
        for (RequestedClaim claim : userinfo) {
            userinfoClaims.put(claim.name(), Map.of("essential", claim.essential()));
        }
        final var parameter = new LinkedHashMap<String, Object>();
        parameter.put("userinfo", userinfoClaims);
        parameter.put("id_token", Map.of());
        return parameter;
    }
}
