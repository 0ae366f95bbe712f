package kyc.adapter.out.provider;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;

import java.time.Duration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import kyc.core.exception.ProfileFetchException;
import kyc.core.exception.TransientNetworkException;
import kyc.core.port.out.VerificationMetrics;
import kyc.testing.TestProviderConfig;

@DisplayName("VertxUserInfoEndpointClient")
@ExtendWith(MockitoExtension.class)
class VertxUserInfoEndpointClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private VerificationMetrics metrics;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private TestProviderConfig config;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        config = new TestProviderConfig();
        config.userinfoEndpoint = "http://localhost:" + wireMockServer.port() + "/oidc/userinfo";
        config.timeout = Duration.ofSeconds(2);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private VertxUserInfoEndpointClient client() {
        return new VertxUserInfoEndpointClient(vertx, config, metrics);
    }

    @Test
    @DisplayName("should send the bearer token and return the JWT body")
    void shouldFetchSignedUserInfo() {
        wireMockServer.stubFor(get(urlEqualTo("/oidc/userinfo"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/jwt")
                        .withBody("header.payload.signature\n")));

        final var body = client().fetch("access-1").await().atMost(TIMEOUT);

        assertEquals("header.payload.signature", body);
        wireMockServer.verify(getRequestedFor(urlEqualTo("/oidc/userinfo"))
                .withHeader("Authorization", equalTo("Bearer access-1"))
                .withHeader("Accept", equalTo("application/jwt")));
        verify(metrics).recordProviderCall("userinfo", "success");
    }

    @Test
    @DisplayName("should reject an unauthorized access token")
    void shouldRejectUnauthorized() {
        wireMockServer.stubFor(get(urlEqualTo("/oidc/userinfo")).willReturn(aResponse().withStatus(401)));

        assertThrows(ProfileFetchException.class, () -> client().fetch("access-1").await().atMost(TIMEOUT));
        verify(metrics).recordProviderCall("userinfo", "rejected");
    }

    @Test
    @DisplayName("should reject an empty body")
    void shouldRejectEmptyBody() {
        wireMockServer.stubFor(get(urlEqualTo("/oidc/userinfo")).willReturn(aResponse().withStatus(200)));

        assertThrows(ProfileFetchException.class, () -> client().fetch("access-1").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should classify a timeout as transient")
    void shouldClassifyTimeout() {
        config.timeout = Duration.ofMillis(300);
        wireMockServer.stubFor(get(urlEqualTo("/oidc/userinfo"))
                .willReturn(aResponse().withStatus(200).withBody("late").withFixedDelay(2000)));

        assertThrows(
                TransientNetworkException.class, () -> client().fetch("access-1").await().atMost(TIMEOUT));
        verify(metrics).recordProviderCall("userinfo", "transient");
    }
}
