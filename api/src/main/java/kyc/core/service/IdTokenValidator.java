package kyc.core.service;

import java.time.Instant;
import java.util.HashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.TokenValidationException;
import kyc.core.exception.VerificationException;
import kyc.core.model.IdTokenClaims;

/**
 * Validates the ID token returned by the token endpoint: provider signature,
 * issuer, audience (the client ID), expiry and the nonce bound to the session.
 */
@ApplicationScoped
public class IdTokenValidator {

    private final ProviderJwtVerifier verifier;
    private final IdentityProviderConfig config;

    @Inject
    public IdTokenValidator(ProviderJwtVerifier verifier, IdentityProviderConfig config) {
        this.verifier = verifier;
        this.config = config;
    }

    public Uni<IdTokenClaims> validate(String idToken, String expectedNonce) {
        return verifier.verify(idToken, ProviderJwtVerifier.Expectations.required(config.issuer(), config.clientId()))
                .map(claims -> toIdTokenClaims(claims, expectedNonce))
                .onFailure(error -> !(error instanceof VerificationException))
                .transform(error -> new TokenValidationException("ID token rejected: " + error.getMessage(), error));
    }

    private static IdTokenClaims toIdTokenClaims(JwtClaims claims, String expectedNonce) {
        final var nonce = claims.getClaimValueAsString("nonce");
        if (nonce == null || !nonce.equals(expectedNonce)) {
            throw new TokenValidationException("ID token nonce does not match the verification session");
        }
        try {
            return new IdTokenClaims(
                    claims.getSubject(),
                    claims.getIssuer(),
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue()),
                    new HashMap<>(claims.getClaimsMap()));
        } catch (MalformedClaimException e) {
            throw new TokenValidationException("ID token has malformed claims: " + e.getMessage(), e);
        }
    }
}
