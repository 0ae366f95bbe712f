package kyc.core.model;

/**
 * States of a verification attempt.
 *
 * <pre>
 * INIT → AWAITING_CALLBACK → STATE_VALIDATED → TOKEN_EXCHANGED → PROFILE_FETCHED → COMPLETE
 *   └──────────────┴──────────────┴──────────────┴────────────────┴──→ FAILED
 * </pre>
 */
public enum VerificationState {
    INIT,
    AWAITING_CALLBACK,
    STATE_VALIDATED,
    TOKEN_EXCHANGED,
    PROFILE_FETCHED,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /**
     * Check whether the state machine may move from this state to {@code next}.
     */
    public boolean canTransitionTo(VerificationState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return switch (this) {
            case INIT -> next == AWAITING_CALLBACK;
            case AWAITING_CALLBACK -> next == STATE_VALIDATED;
            case STATE_VALIDATED -> next == TOKEN_EXCHANGED;
            case TOKEN_EXCHANGED -> next == PROFILE_FETCHED;
            case PROFILE_FETCHED -> next == COMPLETE;
            default -> false;
        };
    }
}
