package kyc.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import kyc.core.model.FailureReason;
import kyc.core.model.VerificationResult;

/**
 * RFC 7807 Problem Details for the verification endpoints.
 *
 * <p>Failed callbacks carry {@code reason}, {@code retryable} and, when the
 * provider supplied one, {@code providerError}. A retryable failure means the
 * UI may start a new attempt; the failed attempt itself is gone.
 */
public final class VerificationProblem {

    private VerificationProblem() {}

    public static HttpProblem callbackFailed(VerificationResult.Failed failed) {
        final var builder = HttpProblem.builder()
                .withTitle(title(failed.reason()))
                .withStatus(status(failed.reason(), failed.retryable()))
                .withDetail(failed.detail())
                .with("reason", failed.reason().name())
                .with("retryable", failed.retryable());
        failed.providerError().ifPresent(error -> builder.with("providerError", error));
        return builder.build();
    }

    public static HttpProblem missingUser() {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail("X-User-Id header is required")
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .with("retryable", true)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    static Status status(FailureReason reason, boolean retryable) {
        return switch (reason) {
            case INVALID_STATE -> Status.BAD_REQUEST;
            case PROVIDER_DENIED -> Status.FORBIDDEN;
            case TOKEN_EXCHANGE_FAILED, PROFILE_FETCH_FAILED -> retryable ? Status.GATEWAY_TIMEOUT : Status.BAD_GATEWAY;
            case PERSISTENCE_FAILED -> Status.INTERNAL_SERVER_ERROR;
        };
    }

    private static String title(FailureReason reason) {
        return switch (reason) {
            case INVALID_STATE -> "Invalid Verification State";
            case PROVIDER_DENIED -> "Verification Denied";
            case TOKEN_EXCHANGE_FAILED -> "Token Exchange Failed";
            case PROFILE_FETCH_FAILED -> "Identity Profile Unavailable";
            case PERSISTENCE_FAILED -> "Verification Not Recorded";
        };
    }
}
