package tech.acecontext.platform.authentication;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * JAX-RS filter that resolves the bearer principal for {@link RequiresTenant}
 * resources and stores it in {@link TenantContext}.
 *
 * When {@code ace.auth.required=true} and no principal resolves, the request
 * is aborted with 401 and a challenge pointing at the protected resource
 * metadata, so clients can discover the authorization server.
 */
@Provider
@RequiresTenant
public class BearerTokenFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(BearerTokenFilter.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    RequestAuthenticator requestAuthenticator;

    @Inject
    TenantContext tenantContext;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        Optional<AuthenticatedPrincipal> principal =
            requestAuthenticator.authenticate(requestContext.getHeaderString(HttpHeaders.AUTHORIZATION));

        if (principal.isPresent()) {
            tenantContext.setPrincipal(principal.get());
            return;
        }

        if (authConfig.required()) {
            String path = requestContext.getUriInfo().getPath();
            LOG.debugf("Rejecting unauthenticated request to %s", path);

            String metadataUrl = ExternalBaseUrl.resolve(authConfig, requestContext.getUriInfo())
                + "/.well-known/oauth-protected-resource";
            requestContext.abortWith(
                Response.status(Response.Status.UNAUTHORIZED)
                    .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer resource_metadata=\"" + metadataUrl + "\"")
                    .type(MediaType.APPLICATION_JSON)
                    .entity(new ErrorResponse("invalid_token", "A valid bearer token is required"))
                    .build()
            );
        }
    }

    /**
     * Error response DTO.
     */
    public record ErrorResponse(String error, String error_description) {
    }
}
