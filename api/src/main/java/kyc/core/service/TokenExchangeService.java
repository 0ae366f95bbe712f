package kyc.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.TokenValidationException;
import kyc.core.model.TokenExchangeRequest;
import kyc.core.model.TokenResponse;
import kyc.core.model.ValidatedTokens;
import kyc.core.model.VerificationSession;
import kyc.core.port.out.TokenEndpointClient;

/**
 * Redeems an authorization code and validates the returned ID token.
 *
 * <p>A fresh client assertion is signed for every exchange. Nothing is retried.
 */
@ApplicationScoped
public class TokenExchangeService {

    private static final Logger LOG = Logger.getLogger(TokenExchangeService.class);

    private final TokenEndpointClient tokenEndpointClient;
    private final ClientAssertionSigner assertionSigner;
    private final IdTokenValidator idTokenValidator;
    private final IdentityProviderConfig config;

    @Inject
    public TokenExchangeService(
            TokenEndpointClient tokenEndpointClient,
            ClientAssertionSigner assertionSigner,
            IdTokenValidator idTokenValidator,
            IdentityProviderConfig config) {
        this.tokenEndpointClient = tokenEndpointClient;
        this.assertionSigner = assertionSigner;
        this.idTokenValidator = idTokenValidator;
        this.config = config;
    }

    /**
     * Exchange the code granted for a session.
     *
     * @param code    authorization code from the callback
     * @param session the consumed verification session
     * @return tokens plus the validated ID token claims
     */
    public Uni<ValidatedTokens> exchange(String code, VerificationSession session) {
        return Uni.createFrom()
                .item(() -> buildRequest(code, session))
                .flatMap(tokenEndpointClient::exchange)
                .flatMap(tokens -> validate(tokens, session));
    }

    private TokenExchangeRequest buildRequest(String code, VerificationSession session) {
        return new TokenExchangeRequest(
                config.tokenEndpoint(),
                code,
                config.redirectUri(),
                config.clientId(),
                session.codeVerifier(),
                config.clientAssertion().type(),
                assertionSigner.sign());
    }

    private Uni<ValidatedTokens> validate(TokenResponse tokens, VerificationSession session) {
        if (tokens.idToken().isEmpty()) {
            LOG.warn("Token response did not include an id_token");
            return Uni.createFrom().failure(new TokenValidationException("Token response did not include an id_token"));
        }
        return idTokenValidator
                .validate(tokens.idToken().get(), session.nonce())
                .map(idToken -> new ValidatedTokens(tokens, idToken));
    }
}
