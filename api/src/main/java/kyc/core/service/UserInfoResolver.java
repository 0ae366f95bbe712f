package kyc.core.service;

import java.util.HashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.ProfileDecodeException;
import kyc.core.exception.VerificationException;
import kyc.core.model.IdTokenClaims;
import kyc.core.model.IdentityProfile;
import kyc.core.port.out.UserInfoEndpointClient;

/**
 * Fetches the signed userinfo JWT, verifies it and normalizes its claims.
 *
 * <p>The userinfo subject must be the subject of the validated ID token.
 */
@ApplicationScoped
public class UserInfoResolver {

    private final UserInfoEndpointClient userInfoClient;
    private final ProviderJwtVerifier verifier;
    private final ClaimNormalizer normalizer;
    private final IdentityProviderConfig config;

    @Inject
    public UserInfoResolver(
            UserInfoEndpointClient userInfoClient,
            ProviderJwtVerifier verifier,
            ClaimNormalizer normalizer,
            IdentityProviderConfig config) {
        this.userInfoClient = userInfoClient;
        this.verifier = verifier;
        this.normalizer = normalizer;
        this.config = config;
    }

    public Uni<IdentityProfile> resolve(String accessToken, IdTokenClaims idToken) {
        return userInfoClient
                .fetch(accessToken)
                .flatMap(body -> verifier.verify(
                        body, ProviderJwtVerifier.Expectations.whenPresent(config.issuer(), config.clientId())))
                .map(claims -> toProfile(claims, idToken))
                .onFailure(error -> !(error instanceof VerificationException))
                .transform(error -> new ProfileDecodeException("Userinfo rejected: " + error.getMessage(), error));
    }

    private IdentityProfile toProfile(JwtClaims claims, IdTokenClaims idToken) {
        final String subject;
        try {
            subject = claims.getSubject();
        } catch (MalformedClaimException e) {
            throw new ProfileDecodeException("Userinfo subject is malformed", e);
        }
        if (!idToken.subject().equals(subject)) {
            throw new ProfileDecodeException("Userinfo subject does not match the ID token subject");
        }
        return normalizer.normalize(subject, new HashMap<>(claims.getClaimsMap()));
    }
}
