package kyc.core.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the external identity provider.
 *
 * <p>Configuration prefix: {@code kyc.provider}
 *
 * <p>Everything the verification flow needs to talk to the provider lives here:
 * endpoint wiring, the client assertion signing key, and the contents of the
 * authorization request. Values are read once at startup and never mutated.
 */
@ConfigMapping(prefix = "kyc.provider")
public interface IdentityProviderConfig {

    /**
     * Client identifier registered with the provider.
     *
     * @return Client ID
     */
    @WithName("client-id")
    String clientId();

    /**
     * Redirect URI registered with the provider; the callback lands here.
     *
     * @return Redirect URI
     */
    @WithName("redirect-uri")
    String redirectUri();

    /**
     * Provider authorization endpoint the browser is redirected to.
     *
     * @return Authorization endpoint URL
     */
    @WithName("authorization-endpoint")
    String authorizationEndpoint();

    /**
     * Provider token endpoint. Also the audience of every client assertion.
     *
     * @return Token endpoint URL
     */
    @WithName("token-endpoint")
    String tokenEndpoint();

    /**
     * Provider userinfo endpoint. Responds with a signed JWT.
     *
     * @return Userinfo endpoint URL
     */
    @WithName("userinfo-endpoint")
    String userinfoEndpoint();

    /**
     * Expected {@code iss} of tokens issued by the provider.
     *
     * @return Issuer identifier
     */
    String issuer();

    /**
     * JWKS endpoint publishing the provider's signing keys.
     *
     * @return JWKS URI
     */
    @WithName("jwks-uri")
    URI jwksUri();

    /**
     * Upper bound for each call to the token and userinfo endpoints.
     *
     * @return Timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * How long fetched provider keys are cached.
     *
     * @return JWKS cache TTL (default: 1 hour)
     */
    @WithName("jwks-cache-ttl")
    @WithDefault("PT1H")
    Duration jwksCacheTtl();

    /**
     * Maximum number of key sets kept in the cache.
     *
     * @return Max entries (default: 10)
     */
    @WithName("jwks-max-entries")
    @WithDefault("10")
    int jwksMaxEntries();

    /**
     * Client assertion (private_key_jwt) configuration.
     */
    @WithName("client-assertion")
    ClientAssertionConfig clientAssertion();

    /**
     * Authorization request configuration.
     */
    AuthorizationConfig authorization();

    /**
     * Client assertion settings.
     */
    interface ClientAssertionConfig {

        /**
         * Value sent as {@code client_assertion_type}.
         *
         * @return Assertion type URN
         */
        @WithDefault("urn:ietf:params:oauth:client-assertion-type:jwt-bearer")
        String type();

        /**
         * Private signing key.
         *
         * <p>Accepted encodings: PEM PKCS#8, base64 PKCS#8, a JSON JWK, or a
         * base64-encoded JSON JWK. Never logged.
         *
         * @return Key material
         */
        @WithName("signing-key")
        Optional<String> signingKey();

        /**
         * JWS algorithm. Derived from the key type when absent.
         *
         * @return Algorithm identifier (e.g. RS256, ES256)
         */
        Optional<String> algorithm();

        /**
         * Value of the {@code kid} header, when the provider expects one.
         *
         * @return Key ID
         */
        @WithName("key-id")
        Optional<String> keyId();

        /**
         * Validity window of each assertion.
         *
         * @return Assertion TTL (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration ttl();
    }

    /**
     * Authorization request settings.
     */
    interface AuthorizationConfig {

        /**
         * Scopes requested from the provider.
         *
         * @return Scopes (default: openid, profile, email)
         */
        @WithDefault("openid,profile,email,userinfo")
        List<String> scopes();

        /**
         * Value of the {@code claims_locales} parameter.
         *
         * @return Space-separated locales (default: "en am")
         */
        @WithName("claims-locales")
        @WithDefault("en am")
        String claimsLocales();

        /**
         * Userinfo claims requested as essential.
         *
         * @return Essential claim names
         */
        @WithName("essential-claims")
        @WithDefault("name,phone_number,email,picture,gender,birthdate,address")
        List<String> essentialClaims();

        /**
         * Userinfo claims requested as voluntary.
         *
         * @return Voluntary claim names
         */
        @WithName("voluntary-claims")
        Optional<List<String>> voluntaryClaims();
    }
}
