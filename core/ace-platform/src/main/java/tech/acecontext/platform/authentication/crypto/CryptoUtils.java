package tech.acecontext.platform.authentication.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Cryptographic primitives shared by the token codec, the client registry
 * and PKCE verification.
 *
 * Every comparison of a secret-derived value (signatures, secret digests,
 * PKCE verifiers) goes through {@link #constantTimeEquals(String, String)}.
 */
public final class CryptoUtils {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();
    private static final String HMAC_SHA256 = "HmacSHA256";

    private CryptoUtils() {
    }

    /**
     * Compare two strings in time independent of where they first differ.
     *
     * Returns false early only when the lengths differ; length is not secret.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return constantTimeEquals(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        if (a == null || b == null) {
            return false;
        }
        if (a.length != b.length) {
            return false;
        }
        int result = 0;
        for (int i = 0; i < a.length; i++) {
            result |= a[i] ^ b[i];
        }
        return result == 0;
    }

    public static byte[] hmacSha256(byte[] secret, byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret, HMAC_SHA256));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * SHA-256 of the UTF-8 bytes of {@code value}, base64url encoded.
     * Used for PKCE S256 challenges and for stored secret and token digests.
     */
    public static String sha256Base64Url(String value) {
        return base64UrlEncode(sha256(value.getBytes(StandardCharsets.UTF_8)));
    }

    public static String base64UrlEncode(byte[] bytes) {
        return URL_ENCODER.encodeToString(bytes);
    }

    /**
     * @throws IllegalArgumentException if the input is not valid unpadded base64url
     */
    public static byte[] base64UrlDecode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot decode null");
        }
        if (value.indexOf('=') >= 0) {
            throw new IllegalArgumentException("Padding is not allowed in base64url values");
        }
        return URL_DECODER.decode(value);
    }

    /**
     * Generate a random token of {@code byteLength} bytes, base64url encoded.
     */
    public static String randomToken(int byteLength) {
        byte[] bytes = new byte[byteLength];
        SECURE_RANDOM.nextBytes(bytes);
        return base64UrlEncode(bytes);
    }
}
