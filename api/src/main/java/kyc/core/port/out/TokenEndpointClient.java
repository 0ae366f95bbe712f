package kyc.core.port.out;

import io.smallrye.mutiny.Uni;

import kyc.core.model.TokenExchangeRequest;
import kyc.core.model.TokenResponse;

/**
 * Client for the provider's token endpoint.
 */
public interface TokenEndpointClient {

    /**
     * Exchange an authorization code for tokens.
     *
     * <p>Fails with {@link kyc.core.exception.TokenExchangeException} when the
     * provider rejects the request and with
     * {@link kyc.core.exception.TransientNetworkException} on timeout or
     * connection failure.
     *
     * @param request exchange parameters, including the signed client assertion
     * @return the token response
     */
    Uni<TokenResponse> exchange(TokenExchangeRequest request);
}
