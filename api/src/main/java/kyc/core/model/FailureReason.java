package kyc.core.model;

/**
 * Why a verification attempt ended in {@link VerificationState#FAILED}.
 */
public enum FailureReason {
    /** State unknown, expired, or already consumed. */
    INVALID_STATE,

    /** The user declined or the provider returned an OAuth error. */
    PROVIDER_DENIED,

    /** Code exchange or ID token validation failed. */
    TOKEN_EXCHANGE_FAILED,

    /** Userinfo could not be fetched or verified. */
    PROFILE_FETCH_FAILED,

    /** The outcome could not be written to the user record. */
    PERSISTENCE_FAILED
}
