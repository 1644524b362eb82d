package tech.acecontext.platform.authentication;

import jakarta.enterprise.context.RequestScoped;

import java.util.Optional;

/**
 * The principal of the current request, set by {@link BearerTokenFilter}.
 */
@RequestScoped
public class TenantContext {

    private AuthenticatedPrincipal principal;

    public void setPrincipal(AuthenticatedPrincipal principal) {
        this.principal = principal;
    }

    public Optional<AuthenticatedPrincipal> getPrincipal() {
        return Optional.ofNullable(principal);
    }

    /**
     * The current authenticated tenant id, if any.
     */
    public Optional<String> getTenantId() {
        return getPrincipal().map(AuthenticatedPrincipal::tenantId);
    }
}
