package kyc.core.model;

/**
 * KYC status of a user, as recorded on the user record.
 */
public enum KycStatus {
    /** Not verified yet, or a verification is in progress. */
    PENDING,

    /** Identity confirmed by the provider. */
    VERIFIED,

    /** Verification refused. Set by operators, never by the provider flow. */
    REJECTED,

    /** A previous verification outlived its validity period. */
    EXPIRED
}
