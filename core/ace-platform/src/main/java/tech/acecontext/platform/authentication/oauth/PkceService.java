package tech.acecontext.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;
import tech.acecontext.platform.authentication.crypto.CryptoUtils;

/**
 * PKCE (Proof Key for Code Exchange) verification.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier))
 * 3. Client sends code_challenge in authorization request
 * 4. Server stores code_challenge with authorization code
 * 5. Client sends code_verifier in token request
 * 6. Server verifies the verifier against the stored challenge
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    /**
     * code_challenge = BASE64URL(SHA256(code_verifier))
     */
    public String generateCodeChallenge(String codeVerifier) {
        return CryptoUtils.sha256Base64Url(codeVerifier);
    }

    /**
     * Verify a code verifier against the challenge stored with an authorization code.
     *
     * @param codeVerifier  the verifier from the token request
     * @param codeChallenge the stored challenge
     * @param method        the stored method, "S256" or "plain"
     * @return true if the verifier matches
     * @throws OAuthException invalid_request for any other stored method
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null) {
            return false;
        }

        CodeChallengeMethod challengeMethod = CodeChallengeMethod.fromValue(method)
            .orElseThrow(() -> new OAuthException(OAuthError.INVALID_REQUEST,
                "Unsupported code_challenge_method"));

        return switch (challengeMethod) {
            case S256 -> CryptoUtils.constantTimeEquals(generateCodeChallenge(codeVerifier), codeChallenge);
            case PLAIN -> CryptoUtils.constantTimeEquals(codeVerifier, codeChallenge);
        };
    }
}
