package tech.acecontext.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.acecontext.platform.authentication.token.AccessTokenService;

import java.util.Optional;

/**
 * Resolves the principal for an inbound resource request.
 *
 * A missing, expired or invalid token is treated as absent. Whether absent
 * is acceptable is decided by {@link BearerTokenFilter}, not here.
 */
@ApplicationScoped
public class RequestAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    AuthConfig authConfig;

    @Inject
    AccessTokenService accessTokenService;

    /**
     * @param authorizationHeader raw Authorization header, may be null
     * @return the token's principal, the anonymous default tenant, or empty
     */
    public Optional<AuthenticatedPrincipal> authenticate(String authorizationHeader) {
        Optional<AuthenticatedPrincipal> principal = extractBearerToken(authorizationHeader)
            .flatMap(accessTokenService::verify);
        if (principal.isPresent()) {
            return principal;
        }
        return authConfig.defaultTenantId()
            .filter(id -> !id.isBlank())
            .map(AuthenticatedPrincipal::anonymous);
    }

    /**
     * Extract the token from {@code Authorization: Bearer <token>}; the scheme is case-insensitive.
     */
    public static Optional<String> extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
