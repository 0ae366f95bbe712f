package kyc.core.port.out;

import java.time.Duration;

import kyc.core.model.FailureReason;

/**
 * Port for verification flow metrics.
 */
public interface VerificationMetrics {

    void recordInitiated();

    void recordCompleted(Duration duration);

    void recordFailed(FailureReason reason, Duration duration);

    /**
     * Record a call to a provider endpoint.
     *
     * @param endpoint logical endpoint name (token, userinfo, jwks)
     * @param outcome  success, error or timeout
     */
    void recordProviderCall(String endpoint, String outcome);
}
