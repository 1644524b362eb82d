package tech.acecontext.platform.authentication.token;

import java.util.HashMap;
import java.util.Map;

/**
 * Authorization request context carried through the federated provider.
 *
 * Never stored. It travels only as the signed {@code state} parameter, so its
 * integrity rests on the server secret. Tokens carry {@code typ = oauth_state}
 * which keeps them from being accepted anywhere an access token is expected.
 *
 * @param originalState the client's opaque state, echoed back unchanged; may be null
 * @param issuedAt      epoch seconds
 * @param expiresAt     epoch seconds
 */
public record AuthorizationState(
    String clientId,
    String redirectUri,
    String codeChallenge,
    String codeChallengeMethod,
    String originalState,
    long issuedAt,
    long expiresAt,
    String nonce
) {

    public static final String TOKEN_TYPE = "oauth_state";

    /**
     * Sign this state into a compact token.
     */
    public String seal(String secret) {
        Map<String, Object> claims = new HashMap<>();
        claims.put("typ", TOKEN_TYPE);
        claims.put("client_id", clientId);
        claims.put("redirect_uri", redirectUri);
        claims.put("code_challenge", codeChallenge);
        claims.put("code_challenge_method", codeChallengeMethod);
        if (originalState != null) {
            claims.put("original_state", originalState);
        }
        claims.put("iat", issuedAt);
        claims.put("exp", expiresAt);
        claims.put("nonce", nonce);
        return SignedTokenCodec.sign(claims, secret);
    }

    /**
     * Verify a state token and recover the request it describes.
     *
     * @throws InvalidTokenException if the token fails verification, has expired,
     *                               is not a state token, or lacks required claims
     */
    public static AuthorizationState open(String token, String secret) throws InvalidTokenException {
        Map<String, Object> claims = SignedTokenCodec.verify(token, secret);
        if (!TOKEN_TYPE.equals(claims.get("typ"))) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Not a state token");
        }

        String clientId = requireString(claims, "client_id");
        String redirectUri = requireString(claims, "redirect_uri");
        String codeChallenge = requireString(claims, "code_challenge");
        String method = requireString(claims, "code_challenge_method");
        Object originalState = claims.get("original_state");
        Object nonce = claims.get("nonce");

        return new AuthorizationState(
            clientId,
            redirectUri,
            codeChallenge,
            method,
            originalState instanceof String ? (String) originalState : null,
            epochSeconds(claims.get("iat")),
            epochSeconds(claims.get("exp")),
            nonce instanceof String ? (String) nonce : null
        );
    }

    private static String requireString(Map<String, Object> claims, String name) throws InvalidTokenException {
        Object value = claims.get(name);
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "State is missing " + name);
        }
        return (String) value;
    }

    private static long epochSeconds(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
