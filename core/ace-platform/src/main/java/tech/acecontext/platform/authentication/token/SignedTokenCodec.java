package tech.acecontext.platform.authentication.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import tech.acecontext.platform.authentication.crypto.CryptoUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compact HMAC-SHA256 signed JSON tokens.
 *
 * Format: {@code base64url(header).base64url(payload).base64url(signature)}
 * where the header is always {@code {"alg":"HS256","typ":"JWT"}} and the
 * signature is HMAC-SHA256 over {@code header.payload} keyed by the server secret.
 *
 * Used for both the authorization state carried through the federated
 * provider and for access tokens. Payload keys are serialized in sorted
 * order so the same claims always produce the same token.
 *
 * Verification runs in a fixed order: split, signature, parse, expiry.
 * Nothing from the payload is trusted before the signature has been checked.
 */
public final class SignedTokenCodec {

    public static final String ALGORITHM = "HS256";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};
    private static final String ENCODED_HEADER = encodeJson(headerClaims());

    private SignedTokenCodec() {
    }

    /**
     * Sign the given claims.
     *
     * @param payload claims to embed; values must be JSON-serializable
     * @param secret  server signing secret
     * @return the compact token
     */
    public static String sign(Map<String, Object> payload, String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalStateException("Signing secret is not configured");
        }
        String signingInput = ENCODED_HEADER + "." + encodeJson(new TreeMap<>(payload));
        return signingInput + "." + signature(signingInput, secret);
    }

    /**
     * Verify a token and return its claims.
     *
     * @throws InvalidTokenException if the token is malformed, the signature
     *                               does not match, or the {@code exp} claim has passed
     */
    public static Map<String, Object> verify(String token, String secret) throws InvalidTokenException {
        if (token == null || secret == null || secret.isEmpty()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Token or secret missing");
        }

        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED,
                "Expected 3 token parts but found " + parts.length);
        }

        String expected = signature(parts[0] + "." + parts[1], secret);
        if (!CryptoUtils.constantTimeEquals(expected, parts[2])) {
            throw new InvalidTokenException(InvalidTokenException.Reason.INVALID_SIGNATURE, "Signature mismatch");
        }

        Map<String, Object> header = decodeJson(parts[0]);
        if (!ALGORITHM.equals(header.get("alg"))) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Unsupported token algorithm");
        }
        Map<String, Object> claims = decodeJson(parts[1]);

        Object exp = claims.get("exp");
        if (exp instanceof Number && Instant.now().getEpochSecond() >= ((Number) exp).longValue()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, "Token expired");
        }
        return claims;
    }

    private static String signature(String signingInput, String secret) {
        byte[] mac = CryptoUtils.hmacSha256(
            secret.getBytes(StandardCharsets.UTF_8),
            signingInput.getBytes(StandardCharsets.US_ASCII));
        return CryptoUtils.base64UrlEncode(mac);
    }

    private static Map<String, Object> headerClaims() {
        Map<String, Object> header = new TreeMap<>();
        header.put("alg", ALGORITHM);
        header.put("typ", "JWT");
        return header;
    }

    private static String encodeJson(Map<String, Object> value) {
        try {
            return CryptoUtils.base64UrlEncode(MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Token claims are not serializable", e);
        }
    }

    private static Map<String, Object> decodeJson(String part) throws InvalidTokenException {
        try {
            Map<String, Object> value = MAPPER.readValue(CryptoUtils.base64UrlDecode(part), CLAIMS_TYPE);
            if (value == null) {
                throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Token part is not a JSON object");
            }
            return value;
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Token part is not valid base64url JSON", e);
        }
    }
}
