package kyc.core.service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.ConfigurationException;
import kyc.core.model.ClaimsManifest;
import kyc.core.model.PkcePair;

/**
 * Builds the provider authorization URL for an Authorization-Code + PKCE request.
 *
 * <p>Query parameters already present on the configured authorization endpoint
 * are kept; the request parameters are appended after them.
 */
@ApplicationScoped
public class AuthorizationRequestBuilder {

    private final IdentityProviderConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public AuthorizationRequestBuilder(IdentityProviderConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Build the authorization URL.
     *
     * @param pkce  PKCE pair whose challenge is sent
     * @param state opaque correlation value
     * @param nonce value the ID token must echo
     * @return absolute authorization URL
     */
    public String build(PkcePair pkce, String state, String nonce) {
        final var authorization = config.authorization();

        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", config.clientId());
        params.put("redirect_uri", config.redirectUri());
        params.put("response_type", "code");
        params.put("scope", String.join(" ", authorization.scopes()));
        params.put("state", state);
        params.put("nonce", nonce);
        params.put("code_challenge", pkce.codeChallenge());
        params.put("code_challenge_method", pkce.codeChallengeMethod());
        params.put("claims_locales", authorization.claimsLocales());
        params.put("claims", claimsParameter());

        final var query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));

        final var endpoint = config.authorizationEndpoint();
        return endpoint + querySeparator(endpoint) + query;
    }

    /**
     * Userinfo claims requested from the provider.
     */
    public ClaimsManifest claimsManifest() {
        final var authorization = config.authorization();
        return ClaimsManifest.of(
                authorization.essentialClaims(), authorization.voluntaryClaims().orElse(List.of()));
    }

    private String claimsParameter() {
        try {
            return objectMapper.writeValueAsString(claimsManifest().toRequestParameter());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Claims request could not be serialized", e);
        }
    }

    private static String querySeparator(String endpoint) {
        if (!endpoint.contains("?")) {
            return "?";
        }
        return endpoint.endsWith("?") || endpoint.endsWith("&") ? "" : "&";
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
