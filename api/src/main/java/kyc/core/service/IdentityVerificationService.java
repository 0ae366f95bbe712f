package kyc.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kyc.core.config.VerificationConfig;
import kyc.core.config.VerificationSessionConfig;
import kyc.core.exception.InvalidStateException;
import kyc.core.exception.ProviderDeniedException;
import kyc.core.exception.TokenExchangeException;
import kyc.core.exception.VerificationException;
import kyc.core.model.AuthorizationRequest;
import kyc.core.model.CallbackRequest;
import kyc.core.model.FailureReason;
import kyc.core.model.KycStatus;
import kyc.core.model.KycStatusReport;
import kyc.core.model.UserVerificationRecord;
import kyc.core.model.VerificationResult;
import kyc.core.model.VerificationSession;
import kyc.core.model.VerificationState;
import kyc.core.port.in.IdentityVerification;
import kyc.core.port.out.UserVerificationRecords;
import kyc.core.port.out.VerificationMetrics;
import kyc.core.port.out.VerificationSessionRepository;

/**
 * Runs identity verification attempts end to end.
 *
 * <p>Initiation stores a single-use session and returns the provider
 * authorization URL. The callback consumes that session and walks
 * {@link VerificationFlow} through token exchange, userinfo and persistence.
 * Every failure ends the attempt as {@link VerificationResult.Failed}; the
 * user's existing KYC record is only written on success.
 */
@ApplicationScoped
public class IdentityVerificationService implements IdentityVerification {

    private static final Logger LOG = Logger.getLogger(IdentityVerificationService.class);

    private final PkceService pkceService;
    private final AuthorizationRequestBuilder authorizationRequestBuilder;
    private final VerificationSessionRepository sessions;
    private final TokenExchangeService tokenExchangeService;
    private final UserInfoResolver userInfoResolver;
    private final VerificationOutcomeMapper outcomeMapper;
    private final UserVerificationRecords records;
    private final VerificationMetrics metrics;
    private final VerificationSessionConfig sessionConfig;
    private final VerificationConfig verificationConfig;
    private final Clock clock;

    @Inject
    public IdentityVerificationService(
            PkceService pkceService,
            AuthorizationRequestBuilder authorizationRequestBuilder,
            VerificationSessionRepository sessions,
            TokenExchangeService tokenExchangeService,
            UserInfoResolver userInfoResolver,
            VerificationOutcomeMapper outcomeMapper,
            UserVerificationRecords records,
            VerificationMetrics metrics,
            VerificationSessionConfig sessionConfig,
            VerificationConfig verificationConfig) {
        this(
                pkceService,
                authorizationRequestBuilder,
                sessions,
                tokenExchangeService,
                userInfoResolver,
                outcomeMapper,
                records,
                metrics,
                sessionConfig,
                verificationConfig,
                Clock.systemUTC());
    }

    IdentityVerificationService(
            PkceService pkceService,
            AuthorizationRequestBuilder authorizationRequestBuilder,
            VerificationSessionRepository sessions,
            TokenExchangeService tokenExchangeService,
            UserInfoResolver userInfoResolver,
            VerificationOutcomeMapper outcomeMapper,
            UserVerificationRecords records,
            VerificationMetrics metrics,
            VerificationSessionConfig sessionConfig,
            VerificationConfig verificationConfig,
            Clock clock) {
        this.pkceService = pkceService;
        this.authorizationRequestBuilder = authorizationRequestBuilder;
        this.sessions = sessions;
        this.tokenExchangeService = tokenExchangeService;
        this.userInfoResolver = userInfoResolver;
        this.outcomeMapper = outcomeMapper;
        this.records = records;
        this.metrics = metrics;
        this.sessionConfig = sessionConfig;
        this.verificationConfig = verificationConfig;
        this.clock = clock;
    }

    @Override
    public Uni<AuthorizationRequest> initiate(String userId) {
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("userId is required"));
        }

        final var flow = VerificationFlow.start();
        final var state = pkceService.generateState();
        final var nonce = pkceService.generateNonce();
        final var pkce = pkceService.generate();
        final var session =
                VerificationSession.create(state, nonce, pkce, userId, clock.instant(), sessionConfig.ttl());

        return sessions.put(session).map(ignored -> {
            final var url = authorizationRequestBuilder.build(pkce, state, nonce);
            flow.advance(VerificationState.AWAITING_CALLBACK);
            metrics.recordInitiated();
            LOG.infof("Verification initiated for user %s, state=%s", userId, abbreviate(state));
            return new AuthorizationRequest(url, state, session.expiresAt());
        });
    }

    @Override
    public Uni<VerificationResult> handleCallback(CallbackRequest callback) {
        final long started = System.nanoTime();
        final var flow = VerificationFlow.awaitingCallback();

        final Uni<VerificationResult> result;
        if (callback.error().isPresent()) {
            final var denied = new ProviderDeniedException(callback.error().get(), callback.errorDescription());
            result = discardSession(callback.state())
                    .<VerificationResult>map(ignored -> flow.fail(
                            FailureReason.PROVIDER_DENIED, denied.getMessage(), Optional.of(denied.error()), false));
        } else {
            result = takeSession(callback.state())
                    .<VerificationResult>flatMap(session -> {
                        flow.advance(VerificationState.STATE_VALIDATED);
                        if (callback.code().isEmpty()) {
                            return Uni.createFrom()
                                    .<VerificationResult>item(flow.fail(
                                            FailureReason.PROVIDER_DENIED,
                                            "Callback did not carry an authorization code",
                                            Optional.empty(),
                                            false));
                        }
                        return complete(flow, session, callback.code().get());
                    })
                    .onFailure(InvalidStateException.class)
                    .recoverWithItem(error ->
                            flow.fail(FailureReason.INVALID_STATE, error.getMessage(), Optional.empty(), false));
        }

        return result.invoke(outcome -> record(outcome, Duration.ofNanos(System.nanoTime() - started)));
    }

    @Override
    public Uni<KycStatusReport> status(String userId) {
        return records.find(userId)
                .map(record -> record.map(this::report).orElseGet(() -> KycStatusReport.pending(userId)));
    }

    private Uni<VerificationResult> complete(VerificationFlow flow, VerificationSession session, String code) {
        return step(() -> tokenExchangeService.exchange(code, session), FailureReason.TOKEN_EXCHANGE_FAILED)
                .invoke(() -> flow.advance(VerificationState.TOKEN_EXCHANGED))
                .flatMap(tokens -> step(
                        () -> userInfoResolver.resolve(tokens.tokens().accessToken(), tokens.idToken()),
                        FailureReason.PROFILE_FETCH_FAILED))
                .invoke(() -> flow.advance(VerificationState.PROFILE_FETCHED))
                .flatMap(profile -> step(
                        () -> outcomeMapper.persist(session.userId(), profile), FailureReason.PERSISTENCE_FAILED))
                .<VerificationResult>map(outcome -> flow.complete(session.userId(), outcome))
                .onFailure(StepFailure.class)
                .recoverWithItem(error -> failed(flow, (StepFailure) error));
    }

    private static <T> Uni<T> step(Supplier<Uni<? extends T>> action, FailureReason reason) {
        return Uni.createFrom().deferred(action).onFailure().transform(error -> new StepFailure(reason, error));
    }

    private VerificationResult.Failed failed(VerificationFlow flow, StepFailure failure) {
        final var cause = failure.getCause();
        final var retryable = cause instanceof VerificationException ve && ve.isRetryable();
        Optional<String> providerError = Optional.empty();
        if (cause instanceof TokenExchangeException tee) {
            providerError = tee.providerError();
        }
        LOG.warnf(
                "Verification step failed at %s: reason=%s, retryable=%s, cause=%s",
                flow.current(), failure.reason, retryable, cause.getMessage());
        return flow.fail(failure.reason, cause.getMessage(), providerError, retryable);
    }

    /**
     * Consume the session bound to {@code state}. Fails with
     * {@link InvalidStateException} when there is none, including when the
     * store itself cannot be reached.
     */
    private Uni<VerificationSession> takeSession(Optional<String> state) {
        if (state.isEmpty()) {
            return Uni.createFrom().failure(new InvalidStateException("Callback did not carry a state"));
        }
        return sessions.takeByState(state.get())
                .onFailure()
                .transform(error -> {
                    LOG.warnf("Session lookup failed for state=%s: %s", abbreviate(state.get()), error.getMessage());
                    return new InvalidStateException("Verification session could not be read", error);
                })
                .map(session ->
                        session.orElseThrow(() -> new InvalidStateException("Unknown, expired or already used state")));
    }

    private Uni<Void> discardSession(Optional<String> state) {
        return takeSession(state)
                .invoke(session -> LOG.infof(
                        "Discarded verification session for user %s after provider error", session.userId()))
                .onFailure(InvalidStateException.class)
                .recoverWithNull()
                .replaceWithVoid();
    }

    private void record(VerificationResult result, Duration duration) {
        if (result instanceof VerificationResult.Completed completed) {
            metrics.recordCompleted(duration);
            LOG.infof("Verification complete for user %s in %d ms", completed.userId(), duration.toMillis());
        } else if (result instanceof VerificationResult.Failed failed) {
            metrics.recordFailed(failed.reason(), duration);
            LOG.infof("Verification failed: reason=%s, history=%s", failed.reason(), failed.history());
        }
    }

    private KycStatusReport report(UserVerificationRecord record) {
        if (record.kycStatus() != KycStatus.VERIFIED || record.verifiedAt() == null) {
            return new KycStatusReport(
                    record.userId(),
                    record.kycStatus(),
                    Optional.ofNullable(record.externalSubjectId()),
                    Optional.ofNullable(record.verifiedAt()),
                    Optional.empty());
        }
        final var expiresAt = record.verifiedAt().plus(verificationConfig.validity());
        final var status = clock.instant().isBefore(expiresAt) ? KycStatus.VERIFIED : KycStatus.EXPIRED;
        return new KycStatusReport(
                record.userId(),
                status,
                Optional.ofNullable(record.externalSubjectId()),
                Optional.of(record.verifiedAt()),
                Optional.of(expiresAt));
    }

    static String abbreviate(String state) {
        return state.length() <= 8 ? state : state.substring(0, 8) + "...";
    }

    private static final class StepFailure extends RuntimeException {
        private final FailureReason reason;

        StepFailure(FailureReason reason, Throwable cause) {
            super(reason.name(), cause, false, false);
            this.reason = reason;
        }
    }
}
