package kyc.core.exception;

/**
 * Thrown when a provider subject is already linked to a different user.
 */
public class IdentityLinkConflictException extends PersistenceException {

    private final String externalSubjectId;

    public IdentityLinkConflictException(String externalSubjectId) {
        super("Identity is already linked to another user");
        this.externalSubjectId = externalSubjectId;
    }

    public String externalSubjectId() {
        return externalSubjectId;
    }
}
