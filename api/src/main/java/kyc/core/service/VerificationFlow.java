package kyc.core.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import kyc.core.model.FailureReason;
import kyc.core.model.VerificationOutcome;
import kyc.core.model.VerificationResult;
import kyc.core.model.VerificationState;

/**
 * Tracks one verification attempt through its states.
 *
 * <p>Not thread-safe; each attempt owns its instance and advances it from a
 * single sequential pipeline.
 */
public final class VerificationFlow {

    private final List<VerificationState> history = new ArrayList<>();
    private VerificationState current;

    private VerificationFlow() {
        current = VerificationState.INIT;
        history.add(current);
    }

    /** A new attempt in {@link VerificationState#INIT}. */
    public static VerificationFlow start() {
        return new VerificationFlow();
    }

    /** An attempt whose authorization request was issued and whose callback has arrived. */
    public static VerificationFlow awaitingCallback() {
        return start().advance(VerificationState.AWAITING_CALLBACK);
    }

    /**
     * Move to the next state.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public VerificationFlow advance(VerificationState next) {
        if (next == VerificationState.FAILED) {
            throw new IllegalStateException("Use fail() to enter FAILED");
        }
        transition(next);
        return this;
    }

    public VerificationResult.Failed fail(
            FailureReason reason, String detail, Optional<String> providerError, boolean retryable) {
        transition(VerificationState.FAILED);
        return new VerificationResult.Failed(reason, detail, providerError, retryable, history);
    }

    public VerificationResult.Completed complete(String userId, VerificationOutcome outcome) {
        transition(VerificationState.COMPLETE);
        return new VerificationResult.Completed(userId, outcome, history);
    }

    public VerificationState current() {
        return current;
    }

    public List<VerificationState> history() {
        return List.copyOf(history);
    }

    private void transition(VerificationState next) {
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal verification transition " + current + " -> " + next);
        }
        current = next;
        history.add(next);
    }
}
