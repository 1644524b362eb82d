package tech.acecontext.platform.authentication.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.AuthConfig;
import tech.acecontext.platform.authentication.AuthenticatedPrincipal;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Issues and verifies self-contained access tokens.
 *
 * Claims: {@code sub} (tenant id), {@code email} (when known), {@code iat},
 * {@code exp}, {@code scope} and {@code typ = access}. There is no server-side
 * store, so a token stays valid until it expires.
 */
@ApplicationScoped
public class AccessTokenService {

    private static final Logger LOG = Logger.getLogger(AccessTokenService.class);

    public static final String TOKEN_TYPE = "access";

    @Inject
    AuthConfig authConfig;

    /**
     * Issue an access token for a tenant.
     *
     * @throws OAuthException server_error when no signing secret is configured
     */
    public String issue(String tenantId, String email) {
        String secret = authConfig.serverSecret()
            .filter(s -> !s.isBlank())
            .orElseThrow(() -> new OAuthException(OAuthError.SERVER_ERROR, "Server signing secret is not configured"));

        long now = Instant.now().getEpochSecond();
        Map<String, Object> claims = new HashMap<>();
        claims.put("sub", tenantId);
        if (email != null) {
            claims.put("email", email);
        }
        claims.put("iat", now);
        claims.put("exp", now + expiresInSeconds());
        claims.put("scope", authConfig.scope());
        claims.put("typ", TOKEN_TYPE);
        return SignedTokenCodec.sign(claims, secret);
    }

    /**
     * Verify an access token.
     *
     * @return the principal, or empty for any invalid, expired or foreign token
     */
    public Optional<AuthenticatedPrincipal> verify(String token) {
        Optional<String> secret = authConfig.serverSecret().filter(s -> !s.isBlank());
        if (secret.isEmpty()) {
            LOG.warn("Rejecting bearer token: server signing secret is not configured");
            return Optional.empty();
        }

        Map<String, Object> claims;
        try {
            claims = SignedTokenCodec.verify(token, secret.get());
        } catch (InvalidTokenException e) {
            LOG.debugf("Rejecting bearer token: %s", e.getReason());
            return Optional.empty();
        }

        if (!TOKEN_TYPE.equals(claims.get("typ"))) {
            LOG.debug("Rejecting bearer token: not an access token");
            return Optional.empty();
        }
        Object sub = claims.get("sub");
        if (!(sub instanceof String) || ((String) sub).isEmpty()) {
            LOG.debug("Rejecting bearer token: missing subject");
            return Optional.empty();
        }
        Object email = claims.get("email");
        return Optional.of(AuthenticatedPrincipal.authenticated(
            (String) sub, email instanceof String ? (String) email : null));
    }

    public long expiresInSeconds() {
        return authConfig.token().accessTokenExpiry().toSeconds();
    }

    public String scope() {
        return authConfig.scope();
    }
}
