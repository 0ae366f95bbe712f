package kyc.adapter.out.provider;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.ProfileFetchException;
import kyc.core.exception.TransientNetworkException;
import kyc.core.port.out.UserInfoEndpointClient;
import kyc.core.port.out.VerificationMetrics;

/**
 * Fetches the signed userinfo document with the access token as bearer credential.
 */
@ApplicationScoped
public class VertxUserInfoEndpointClient implements UserInfoEndpointClient {

    private static final Logger LOG = Logger.getLogger(VertxUserInfoEndpointClient.class);
    static final String ENDPOINT = "userinfo";

    private final WebClient webClient;
    private final String userinfoEndpoint;
    private final Duration timeout;
    private final VerificationMetrics metrics;

    @Inject
    public VertxUserInfoEndpointClient(Vertx vertx, IdentityProviderConfig config, VerificationMetrics metrics) {
        this.webClient = WebClient.create(vertx);
        this.userinfoEndpoint = config.userinfoEndpoint();
        this.timeout = config.timeout();
        this.metrics = metrics;
    }

    @Override
    public Uni<String> fetch(String accessToken) {
        LOG.debugf("Fetching userinfo from %s", userinfoEndpoint);

        return webClient
                .getAbs(userinfoEndpoint)
                .timeout(timeout.toMillis())
                .putHeader("Authorization", "Bearer " + accessToken)
                .putHeader("Accept", "application/jwt")
                .send()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new TransientNetworkException("Userinfo endpoint did not respond within " + timeout))
                .map(this::readBody)
                .onFailure()
                .transform(error -> ProviderCalls.classify(error, ENDPOINT, ProfileFetchException::new))
                .onItemOrFailure()
                .invoke((item, error) -> metrics.recordProviderCall(
                        ENDPOINT, error == null ? ProviderCalls.SUCCESS : ProviderCalls.outcome(error)));
    }

    private String readBody(HttpResponse<Buffer> response) {
        if (!ProviderCalls.isSuccess(response.statusCode())) {
            LOG.warnf("Userinfo endpoint returned status %d", response.statusCode());
            throw new ProfileFetchException("Userinfo endpoint returned status " + response.statusCode());
        }
        final var body = response.bodyAsString();
        if (body == null || body.isBlank()) {
            throw new ProfileFetchException("Userinfo endpoint returned an empty body");
        }
        return body.trim();
    }
}
