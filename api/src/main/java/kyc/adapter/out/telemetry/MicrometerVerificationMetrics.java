package kyc.adapter.out.telemetry;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import kyc.core.model.FailureReason;
import kyc.core.port.out.VerificationMetrics;

/**
 * Micrometer metrics for verification attempts.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code kyc.verification.initiated} - authorization URLs issued</li>
 *   <li>{@code kyc.verification.completed} - finished callbacks by outcome and failure reason</li>
 *   <li>{@code kyc.verification.duration} - callback handling latency by outcome</li>
 *   <li>{@code kyc.provider.calls} - identity provider calls by endpoint and outcome</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerVerificationMetrics implements VerificationMetrics {

    private static final String NONE = "none";

    private final MeterRegistry registry;

    @Inject
    public MicrometerVerificationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordInitiated() {
        Counter.builder("kyc.verification.initiated")
                .description("Verification attempts started")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCompleted(Duration duration) {
        record("verified", NONE, duration);
    }

    @Override
    public void recordFailed(FailureReason reason, Duration duration) {
        record("failed", reason.name().toLowerCase(), duration);
    }

    @Override
    public void recordProviderCall(String endpoint, String outcome) {
        Counter.builder("kyc.provider.calls")
                .description("Identity provider HTTP calls")
                .tag("endpoint", nullSafe(endpoint))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    private void record(String outcome, String reason, Duration duration) {
        Counter.builder("kyc.verification.completed")
                .description("Verification callbacks handled")
                .tag("outcome", outcome)
                .tag("reason", reason)
                .register(registry)
                .increment();

        Timer.builder("kyc.verification.duration")
                .description("Verification callback handling latency")
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry)
                .record(duration);
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
