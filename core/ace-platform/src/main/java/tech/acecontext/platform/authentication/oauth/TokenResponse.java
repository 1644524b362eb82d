package tech.acecontext.platform.authentication.oauth;

/**
 * Successful token endpoint response (RFC 6749 Section 5.1).
 */
public record TokenResponse(
    String access_token,
    String token_type,
    long expires_in,
    String refresh_token,
    String scope
) {

    public static TokenResponse bearer(String accessToken, long expiresIn, String refreshToken, String scope) {
        return new TokenResponse(accessToken, "Bearer", expiresIn, refreshToken, scope);
    }
}
