package kyc.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import kyc.core.model.AuthorizationRequest;
import kyc.core.model.CallbackRequest;
import kyc.core.model.FailureReason;
import kyc.core.model.KycStatus;
import kyc.core.model.KycStatusReport;
import kyc.core.model.PersonalInfo;
import kyc.core.model.VerificationOutcome;
import kyc.core.model.VerificationResult;
import kyc.core.model.VerificationState;
import kyc.core.port.in.IdentityVerification;

@DisplayName("VerificationResource")
@ExtendWith(MockitoExtension.class)
class VerificationResourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private IdentityVerification identityVerification;

    private VerificationResource resource;

    @BeforeEach
    void setUp() {
        resource = new VerificationResource(identityVerification);
    }

    @Nested
    @DisplayName("GET /kyc/authorize")
    class AuthorizeTests {

        @Test
        @DisplayName("should return the authorization URL for the user")
        void shouldAuthorize() {
            final var expiresAt = Instant.now().plusSeconds(600);
            when(identityVerification.initiate("user-1"))
                    .thenReturn(Uni.createFrom()
                            .item(new AuthorizationRequest("https://idp.example.com/authorize?x=1", "state-1", expiresAt)));

            final var dto = resource.authorize("user-1").await().atMost(TIMEOUT);

            assertEquals("https://idp.example.com/authorize?x=1", dto.authorizationUrl());
            assertEquals("state-1", dto.state());
            assertEquals(expiresAt, dto.expiresAt());
        }

        @Test
        @DisplayName("should answer 401 without a user header")
        void shouldRequireUser() {
            final var problem = assertThrows(HttpProblem.class, () -> resource.authorize(null));

            assertEquals(401, problem.getStatusCode());
            verifyNoInteractions(identityVerification);
        }
    }

    @Nested
    @DisplayName("/kyc/callback")
    class CallbackTests {

        @Test
        @DisplayName("should return the verified profile")
        void shouldReturnCompletedResult() {
            final var outcome = new VerificationOutcome(
                    "fayda-123",
                    new PersonalInfo("Abebe", "Kebede", "abebe@example.et", null, null, null, null, null),
                    KycStatus.VERIFIED,
                    Instant.now(),
                    Map.of());
            final var history = List.of(
                    VerificationState.INIT,
                    VerificationState.AWAITING_CALLBACK,
                    VerificationState.STATE_VALIDATED,
                    VerificationState.TOKEN_EXCHANGED,
                    VerificationState.PROFILE_FETCHED,
                    VerificationState.COMPLETE);
            when(identityVerification.handleCallback(any()))
                    .thenReturn(Uni.createFrom().item(new VerificationResult.Completed("user-1", outcome, history)));

            final var dto = resource.callback("code-1", "state-1", null, null).await().atMost(TIMEOUT);

            assertEquals(VerificationState.COMPLETE, dto.status());
            assertEquals("user-1", dto.userId());
            assertEquals("fayda-123", dto.externalSubjectId());
            assertEquals("Abebe", dto.personalInfo().firstName());
        }

        @Test
        @DisplayName("should pass the provider error through to the service")
        void shouldPassProviderError() {
            final var captor = ArgumentCaptor.forClass(CallbackRequest.class);
            when(identityVerification.handleCallback(captor.capture()))
                    .thenReturn(Uni.createFrom().item(failed(FailureReason.PROVIDER_DENIED, false)));

            final var problem = assertThrows(
                    HttpProblem.class,
                    () -> resource.callback(null, "state-1", "access_denied", "User cancelled")
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(Optional.of("access_denied"), captor.getValue().error());
            assertEquals(Optional.of("User cancelled"), captor.getValue().errorDescription());
            assertEquals(403, problem.getStatusCode());
            assertEquals("PROVIDER_DENIED", problem.getParameters().get("reason"));
        }

        @Test
        @DisplayName("should accept form_post callbacks")
        void shouldAcceptFormPost() {
            when(identityVerification.handleCallback(any()))
                    .thenReturn(Uni.createFrom().item(failed(FailureReason.INVALID_STATE, false)));

            final var problem = assertThrows(
                    HttpProblem.class,
                    () -> resource.callbackForm("code-1", "bogus", null, null).await().atMost(TIMEOUT));

            assertEquals(400, problem.getStatusCode());
            verify(identityVerification).handleCallback(CallbackRequest.success("code-1", "bogus"));
        }

        @Test
        @DisplayName("should mark a transient failure retryable")
        void shouldMarkRetryable() {
            when(identityVerification.handleCallback(any()))
                    .thenReturn(Uni.createFrom().item(failed(FailureReason.PROFILE_FETCH_FAILED, true)));

            final var problem = assertThrows(
                    HttpProblem.class,
                    () -> resource.callback("code-1", "state-1", null, null).await().atMost(TIMEOUT));

            assertEquals(504, problem.getStatusCode());
            assertEquals(true, problem.getParameters().get("retryable"));
        }
    }

    @Nested
    @DisplayName("GET /kyc/status")
    class StatusTests {

        @Test
        @DisplayName("should report the user's status")
        void shouldReportStatus() {
            final var verifiedAt = Instant.now();
            when(identityVerification.status("user-1"))
                    .thenReturn(Uni.createFrom()
                            .item(new KycStatusReport(
                                    "user-1",
                                    KycStatus.VERIFIED,
                                    Optional.of("fayda-123"),
                                    Optional.of(verifiedAt),
                                    Optional.of(verifiedAt.plus(Duration.ofDays(365))))));

            final var dto = resource.status("user-1").await().atMost(TIMEOUT);

            assertEquals(KycStatus.VERIFIED, dto.kycStatus());
            assertTrue(dto.verified());
            assertEquals("fayda-123", dto.externalSubjectId());
        }

        @Test
        @DisplayName("should answer 401 for a blank user header")
        void shouldRequireUser() {
            final var problem = assertThrows(HttpProblem.class, () -> resource.status("  "));

            assertEquals(401, problem.getStatusCode());
        }
    }

    private static VerificationResult.Failed failed(FailureReason reason, boolean retryable) {
        return new VerificationResult.Failed(
                reason,
                "failed",
                reason == FailureReason.PROVIDER_DENIED ? Optional.of("access_denied") : Optional.empty(),
                retryable,
                List.of(VerificationState.INIT, VerificationState.AWAITING_CALLBACK, VerificationState.FAILED));
    }
}
