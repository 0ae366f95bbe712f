package kyc.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for verification results.
 *
 * <p>Configuration prefix: {@code kyc.verification}
 */
@ConfigMapping(prefix = "kyc.verification")
public interface VerificationConfig {

    /**
     * How long a successful verification is honoured before it reports as expired.
     *
     * @return Validity period (default: 365 days)
     */
    @WithDefault("P365D")
    Duration validity();
}
