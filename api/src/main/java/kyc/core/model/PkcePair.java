package kyc.core.model;

/**
 * PKCE verifier and the challenge derived from it (RFC 7636).
 *
 * @param codeVerifier        high-entropy secret kept until the code exchange
 * @param codeChallenge       BASE64URL(SHA256(codeVerifier))
 * @param codeChallengeMethod always {@code S256}
 */
public record PkcePair(String codeVerifier, String codeChallenge, String codeChallengeMethod) {

    public PkcePair {
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new IllegalArgumentException("codeVerifier is required");
        }
        if (codeChallenge == null || codeChallenge.isBlank()) {
            throw new IllegalArgumentException("codeChallenge is required");
        }
        if (codeChallengeMethod == null || codeChallengeMethod.isBlank()) {
            throw new IllegalArgumentException("codeChallengeMethod is required");
        }
    }
}
