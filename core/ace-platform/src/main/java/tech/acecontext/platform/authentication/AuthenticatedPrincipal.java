package tech.acecontext.platform.authentication;

/**
 * The verified identity behind an inbound resource request.
 *
 * @param tenantId  tenant the request acts for
 * @param email     informational email from the access token, may be null
 * @param anonymous true when no valid token was presented and the configured
 *                  default tenant was used instead
 */
public record AuthenticatedPrincipal(String tenantId, String email, boolean anonymous) {

    public static AuthenticatedPrincipal authenticated(String tenantId, String email) {
        return new AuthenticatedPrincipal(tenantId, email, false);
    }

    public static AuthenticatedPrincipal anonymous(String tenantId) {
        return new AuthenticatedPrincipal(tenantId, null, true);
    }
}
