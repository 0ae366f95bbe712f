package kyc.adapter.in.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kyc.testing.InjectProviderStub;
import kyc.testing.ProviderKeys;
import kyc.testing.ProviderStubResource;
import kyc.testing.TestProviderConfig;

/**
 * End-to-end tests of the verification endpoints against a stubbed identity provider.
 */
@QuarkusTest
@QuarkusTestResource(value = ProviderStubResource.class, restrictToAnnotatedClass = true)
@DisplayName("Verification Resource Integration Tests")
public class VerificationResourceIntegrationTest {

    private static final String PROBLEM_JSON = "application/problem+json";

    @InjectProviderStub
    WireMockServer provider;

    @BeforeEach
    void setUp() {
        provider.resetAll();
        provider.stubFor(get(urlEqualTo(ProviderStubResource.JWKS_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(ProviderKeys.providerJwksJson())));
    }

    /** Authorization response for {@code userId}, as a {@code state}/{@code nonce} pair. */
    private Map<String, String> authorize(String userId) {
        final String url = given().header("X-User-Id", userId)
                .when()
                .get("/kyc/authorize")
                .then()
                .statusCode(200)
                .extract()
                .path("authorization_url");
        return Map.of("state", queryParam(url, "state"), "nonce", queryParam(url, "nonce"));
    }

    private void providerIssuesTokens(String subject, String nonce, String accessToken) {
        final var idToken = ProviderKeys.sign(ProviderKeys.idTokenClaims(subject, nonce));
        provider.stubFor(post(urlEqualTo(ProviderStubResource.TOKEN_PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"access_token\":\"" + accessToken + "\",\"token_type\":\"Bearer\","
                                + "\"expires_in\":300,\"id_token\":\"" + idToken + "\"}")));
    }

    private void providerReleasesProfile(String subject, String accessToken) {
        final var userInfo = ProviderKeys.sign(ProviderKeys.userInfoClaims(
                subject,
                Map.of(
                        "name#en", "Abebe Kebede",
                        "email", "abebe@example.et",
                        "phone_number", "+251911000000",
                        "birthdate", "1990/01/01")));
        provider.stubFor(get(urlEqualTo(ProviderStubResource.USERINFO_PATH))
                .withHeader("Authorization", WireMock.equalTo("Bearer " + accessToken))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/jwt")
                        .withBody(userInfo)));
    }

    private static String queryParam(String url, String name) {
        for (String pair : URI.create(url).getRawQuery().split("&")) {
            final var eq = pair.indexOf('=');
            if (pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        throw new AssertionError("Missing query parameter " + name);
    }

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("GET /kyc/authorize should return the provider URL with PKCE, state and scopes")
    void shouldReturnAuthorizationUrl() {
        given().header("X-User-Id", unique("user"))
                .when()
                .get("/kyc/authorize")
                .then()
                .statusCode(200)
                .contentType(ContentType.JSON)
                .body("authorization_url", startsWith(TestProviderConfig.AUTHORIZATION_ENDPOINT + "?"))
                .body("authorization_url", containsString("code_challenge_method=S256"))
                .body("authorization_url", containsString("scope=openid+profile+email+userinfo"))
                .body("state", notNullValue())
                .body("expires_at", notNullValue());
    }

    @Test
    @DisplayName("GET /kyc/authorize should answer 401 without X-User-Id")
    void shouldRequireUserHeader() {
        given().when()
                .get("/kyc/authorize")
                .then()
                .statusCode(401)
                .contentType(PROBLEM_JSON)
                .body("detail", containsString("X-User-Id"));
    }

    @Test
    @DisplayName("GET /kyc/callback should verify the user and /kyc/status should report it")
    void shouldCompleteVerification() {
        final var userId = unique("user");
        final var subject = unique("fayda");
        final var attempt = authorize(userId);
        providerIssuesTokens(subject, attempt.get("nonce"), "access-" + userId);
        providerReleasesProfile(subject, "access-" + userId);

        given().queryParam("code", "code-1")
                .queryParam("state", attempt.get("state"))
                .when()
                .get("/kyc/callback")
                .then()
                .statusCode(200)
                .body("status", equalTo("COMPLETE"))
                .body("user_id", equalTo(userId))
                .body("kyc_status", equalTo("VERIFIED"))
                .body("external_subject_id", equalTo(subject))
                .body("history", hasItem("TOKEN_EXCHANGED"));

        provider.verify(postRequestedFor(urlEqualTo(ProviderStubResource.TOKEN_PATH))
                .withRequestBody(containing("grant_type=authorization_code"))
                .withRequestBody(containing("code_verifier="))
                .withRequestBody(containing("client_assertion=")));

        given().header("X-User-Id", userId)
                .when()
                .get("/kyc/status")
                .then()
                .statusCode(200)
                .body("kyc_status", equalTo("VERIFIED"))
                .body("verified", equalTo(true))
                .body("external_subject_id", equalTo(subject));
    }

    @Test
    @DisplayName("GET /kyc/status should report PENDING for a user never verified")
    void shouldReportPending() {
        given().header("X-User-Id", unique("user"))
                .when()
                .get("/kyc/status")
                .then()
                .statusCode(200)
                .body("kyc_status", equalTo("PENDING"))
                .body("verified", equalTo(false));
    }

    @Test
    @DisplayName("GET /kyc/callback should answer 400 INVALID_STATE for an unknown state")
    void shouldRejectUnknownState() {
        given().queryParam("code", "code-1")
                .queryParam("state", "never-issued")
                .when()
                .get("/kyc/callback")
                .then()
                .statusCode(400)
                .contentType(PROBLEM_JSON)
                .body("reason", equalTo("INVALID_STATE"))
                .body("retryable", equalTo(false));
    }

    @Test
    @DisplayName("GET /kyc/callback should answer 400 when the state is replayed")
    void shouldRejectReplayedState() {
        final var userId = unique("user");
        final var subject = unique("fayda");
        final var attempt = authorize(userId);
        providerIssuesTokens(subject, attempt.get("nonce"), "access-" + userId);
        providerReleasesProfile(subject, "access-" + userId);
        given().queryParam("code", "code-1")
                .queryParam("state", attempt.get("state"))
                .get("/kyc/callback")
                .then()
                .statusCode(200);

        given().queryParam("code", "code-1")
                .queryParam("state", attempt.get("state"))
                .when()
                .get("/kyc/callback")
                .then()
                .statusCode(400)
                .body("reason", equalTo("INVALID_STATE"));
    }

    @Test
    @DisplayName("POST /kyc/callback should answer 403 PROVIDER_DENIED for a form-posted denial")
    void shouldReportFormPostedDenial() {
        final var attempt = authorize(unique("user"));

        given().contentType(ContentType.URLENC)
                .formParam("state", attempt.get("state"))
                .formParam("error", "access_denied")
                .formParam("error_description", "User cancelled")
                .when()
                .post("/kyc/callback")
                .then()
                .statusCode(403)
                .contentType(PROBLEM_JSON)
                .body("reason", equalTo("PROVIDER_DENIED"))
                .body("providerError", equalTo("access_denied"));
    }

    @Test
    @DisplayName("GET /kyc/callback should answer 502 TOKEN_EXCHANGE_FAILED when the code is rejected")
    void shouldReportRejectedCodeExchange() {
        final var attempt = authorize(unique("user"));
        provider.stubFor(post(urlEqualTo(ProviderStubResource.TOKEN_PATH))
                .willReturn(aResponse()
                        .withStatus(400)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":\"invalid_grant\",\"error_description\":\"Code expired\"}")));

        given().queryParam("code", "code-1")
                .queryParam("state", attempt.get("state"))
                .when()
                .get("/kyc/callback")
                .then()
                .statusCode(502)
                .contentType(PROBLEM_JSON)
                .body("reason", equalTo("TOKEN_EXCHANGE_FAILED"))
                .body("retryable", equalTo(false))
                .body("providerError", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("GET /kyc/callback should answer 504 PROFILE_FETCH_FAILED when userinfo times out")
    void shouldReportUserInfoTimeout() {
        final var userId = unique("user");
        final var subject = unique("fayda");
        final var attempt = authorize(userId);
        providerIssuesTokens(subject, attempt.get("nonce"), "access-" + userId);
        provider.stubFor(get(urlEqualTo(ProviderStubResource.USERINFO_PATH))
                .willReturn(aResponse().withStatus(200).withFixedDelay(3000)));

        given().queryParam("code", "code-1")
                .queryParam("state", attempt.get("state"))
                .when()
                .get("/kyc/callback")
                .then()
                .statusCode(504)
                .contentType(PROBLEM_JSON)
                .body("reason", equalTo("PROFILE_FETCH_FAILED"))
                .body("retryable", equalTo(true));
    }

    @Test
    @DisplayName("GET /kyc/callback should answer 500 PERSISTENCE_FAILED when the identity is linked elsewhere")
    void shouldReportIdentityConflict() {
        final var subject = unique("fayda");
        final var firstUser = unique("user");
        final var first = authorize(firstUser);
        providerIssuesTokens(subject, first.get("nonce"), "access-" + firstUser);
        providerReleasesProfile(subject, "access-" + firstUser);
        given().queryParam("code", "code-1")
                .queryParam("state", first.get("state"))
                .get("/kyc/callback")
                .then()
                .statusCode(200);

        final var secondUser = unique("user");
        final var second = authorize(secondUser);
        providerIssuesTokens(subject, second.get("nonce"), "access-" + secondUser);
        providerReleasesProfile(subject, "access-" + secondUser);

        given().queryParam("code", "code-2")
                .queryParam("state", second.get("state"))
                .when()
                .get("/kyc/callback")
                .then()
                .statusCode(500)
                .contentType(PROBLEM_JSON)
                .body("reason", equalTo("PERSISTENCE_FAILED"));

        given().header("X-User-Id", secondUser)
                .when()
                .get("/kyc/status")
                .then()
                .statusCode(200)
                .body("kyc_status", equalTo("PENDING"));
    }
}
