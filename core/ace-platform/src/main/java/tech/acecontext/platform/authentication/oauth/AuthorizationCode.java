package tech.acecontext.platform.authentication.oauth;

import java.time.Instant;

/**
 * One-time authorization code minted at the federated callback.
 *
 * Authorization codes are:
 * - Short-lived (default: 5 minutes)
 * - Single-use (the row is deleted when redeemed)
 * - Bound to client, redirect URI and PKCE challenge
 */
public class AuthorizationCode {

    /**
     * The code value (32 random bytes, base64url).
     */
    public String code;

    public String clientId;

    /**
     * Redirect URI used in the authorization request.
     * Must match exactly during token exchange.
     */
    public String redirectUri;

    public String tenantId;

    public String codeChallenge;

    /**
     * PKCE challenge method (S256 or plain).
     */
    public String codeChallengeMethod;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }
}
