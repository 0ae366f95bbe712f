package kyc.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Terminal result of handling a provider callback.
 */
public sealed interface VerificationResult {

    /**
     * States the attempt went through while handling the callback, in order.
     */
    List<VerificationState> history();

    /**
     * State the attempt ended in.
     */
    default VerificationState finalState() {
        return history().get(history().size() - 1);
    }

    /**
     * The user was verified and the outcome persisted.
     *
     * @param userId  verified user
     * @param outcome persisted outcome
     * @param history visited states
     */
    record Completed(String userId, VerificationOutcome outcome, List<VerificationState> history)
            implements VerificationResult {
        public Completed {
            history = List.copyOf(history);
        }
    }

    /**
     * The attempt failed. The user's KYC record was left untouched.
     *
     * @param reason        failure category
     * @param detail        human-readable reason
     * @param providerError OAuth error code returned by the provider, if any
     * @param retryable     true when a brand-new attempt may succeed (transient network failure)
     * @param history       visited states, ending in FAILED
     */
    record Failed(
            FailureReason reason,
            String detail,
            Optional<String> providerError,
            boolean retryable,
            List<VerificationState> history)
            implements VerificationResult {
        public Failed {
            if (providerError == null) {
                providerError = Optional.empty();
            }
            history = List.copyOf(history);
        }
    }
}
