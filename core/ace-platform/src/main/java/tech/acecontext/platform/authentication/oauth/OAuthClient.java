package tech.acecontext.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A confidential OAuth client.
 *
 * Clients are created by dynamic registration or come from static
 * configuration (the trusted client). They are immutable once created.
 *
 * Security: only the SHA-256 digest of the client secret is kept.
 */
public class OAuthClient {

    /**
     * Public client identifier, e.g. "oac_0HZXEQ5Y8JY5Z".
     */
    public String clientId;

    public String clientName;

    /**
     * base64url(SHA-256(client_secret)).
     */
    public String secretHash;

    /**
     * Allowed redirect URIs, matched byte for byte.
     */
    public List<String> redirectUris = new ArrayList<>();

    public Instant createdAt = Instant.now();

    public boolean isRedirectUriAllowed(String redirectUri) {
        return redirectUri != null && redirectUris.contains(redirectUri);
    }
}
