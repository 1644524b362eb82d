package tech.acecontext.platform.authentication.oauth;

import java.time.Instant;

/**
 * Stored refresh token.
 *
 * Each use deletes the record and inserts a new one (rotation), so a
 * refresh token is redeemable exactly once.
 *
 * Security: Only the token hash is stored, not the actual token.
 */
public class RefreshToken {

    /**
     * base64url(SHA-256(refresh_token)).
     */
    public String tokenHash;

    public String tenantId;

    /**
     * OAuth client the token was issued to.
     */
    public String clientId;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }
}
