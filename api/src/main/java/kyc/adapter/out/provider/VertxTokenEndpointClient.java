package kyc.adapter.out.provider;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.TokenExchangeException;
import kyc.core.exception.TransientNetworkException;
import kyc.core.model.TokenExchangeRequest;
import kyc.core.model.TokenResponse;
import kyc.core.port.out.TokenEndpointClient;
import kyc.core.port.out.VerificationMetrics;

/**
 * Token endpoint client authenticating with {@code private_key_jwt} (RFC 7523)
 * and sending the PKCE verifier (RFC 7636).
 *
 * <p>Requests are sent once; a timeout or connection failure surfaces as
 * {@link TransientNetworkException} and is left to the caller.
 */
@ApplicationScoped
public class VertxTokenEndpointClient implements TokenEndpointClient {

    private static final Logger LOG = Logger.getLogger(VertxTokenEndpointClient.class);
    static final String ENDPOINT = "token";

    private final WebClient webClient;
    private final Duration timeout;
    private final VerificationMetrics metrics;

    @Inject
    public VertxTokenEndpointClient(Vertx vertx, IdentityProviderConfig config, VerificationMetrics metrics) {
        this.webClient = WebClient.create(vertx);
        this.timeout = config.timeout();
        this.metrics = metrics;
    }

    @Override
    public Uni<TokenResponse> exchange(TokenExchangeRequest request) {
        LOG.debugf("Exchanging authorization code at %s", request.tokenEndpoint());

        return webClient
                .postAbs(request.tokenEndpoint())
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(buildFormBody(request)))
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new TransientNetworkException("Token endpoint did not respond within " + timeout))
                .map(this::parseTokenResponse)
                .onFailure()
                .transform(error -> ProviderCalls.classify(error, ENDPOINT, TokenExchangeException::new))
                .onItemOrFailure()
                .invoke((item, error) -> metrics.recordProviderCall(
                        ENDPOINT, error == null ? ProviderCalls.SUCCESS : ProviderCalls.outcome(error)));
    }

    static String buildFormBody(TokenExchangeRequest request) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("code", request.authorizationCode());
        if (request.redirectUri() != null && !request.redirectUri().isBlank()) {
            params.put("redirect_uri", request.redirectUri());
        }
        params.put("client_id", request.clientId());
        params.put("code_verifier", request.codeVerifier());
        params.put("client_assertion_type", request.clientAssertionType());
        params.put("client_assertion", request.clientAssertion().serialized());

        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private TokenResponse parseTokenResponse(HttpResponse<Buffer> response) {
        if (!ProviderCalls.isSuccess(response.statusCode())) {
            throw errorResponse(response);
        }

        try {
            final JsonObject json = response.bodyAsJsonObject();
            if (json == null) {
                throw new TokenExchangeException("Token endpoint returned an empty body");
            }
            final var accessToken = json.getString("access_token");
            if (accessToken == null || accessToken.isBlank()) {
                throw new TokenExchangeException("Token response missing access_token");
            }
            final var expiresIn = json.getLong("expires_in", 0L);
            LOG.debugf("Token exchange successful, expires_in: %d", expiresIn);
            return new TokenResponse(
                    accessToken,
                    json.getString("token_type"),
                    expiresIn,
                    Optional.ofNullable(json.getString("scope")),
                    Optional.ofNullable(json.getString("id_token")));
        } catch (DecodeException | ClassCastException e) {
            throw new TokenExchangeException("Token response is not valid JSON: " + e.getMessage());
        }
    }

    private TokenExchangeException errorResponse(HttpResponse<Buffer> response) {
        final var status = response.statusCode();
        String error = null;
        String description = null;
        try {
            final var json = response.bodyAsJsonObject();
            if (json != null) {
                error = json.getString("error");
                description = json.getString("error_description");
            }
        } catch (DecodeException | ClassCastException e) {
            LOG.debugf("Token error response is not an OAuth error document: %s", e.getMessage());
        }
        LOG.warnf("Token endpoint returned status %d, error=%s", status, error);
        return new TokenExchangeException("Token endpoint returned status " + status, status, error, description);
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
