package kyc.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Client for the provider's userinfo endpoint.
 */
public interface UserInfoEndpointClient {

    /**
     * Fetch the userinfo document for an access token.
     *
     * <p>Fails with {@link kyc.core.exception.ProfileFetchException} on an HTTP
     * error and with {@link kyc.core.exception.TransientNetworkException} on
     * timeout or connection failure.
     *
     * @param accessToken bearer token from the code exchange
     * @return the compact JWT returned by the provider
     */
    Uni<String> fetch(String accessToken);
}
