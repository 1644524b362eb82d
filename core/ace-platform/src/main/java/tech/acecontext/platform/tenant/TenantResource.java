package tech.acecontext.platform.tenant;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.acecontext.platform.authentication.AuthenticatedPrincipal;
import tech.acecontext.platform.authentication.RequiresTenant;
import tech.acecontext.platform.authentication.TenantContext;

import java.util.Optional;

/**
 * Exposes the verified principal of the calling request to the protocol layer.
 */
@Path("/api/tenant")
@Tag(name = "Tenant", description = "Current tenant of the authenticated caller")
@Produces(MediaType.APPLICATION_JSON)
@RequiresTenant
public class TenantResource {

    @Inject
    TenantContext tenantContext;

    @GET
    @Operation(summary = "Get the tenant the bearer token acts for")
    public Response current() {
        Optional<AuthenticatedPrincipal> principal = tenantContext.getPrincipal();
        if (principal.isEmpty()) {
            return Response.noContent().build();
        }
        AuthenticatedPrincipal p = principal.get();
        return Response.ok(new PrincipalResponse(p.tenantId(), p.email(), p.anonymous())).build();
    }

    public record PrincipalResponse(String tenant_id, String email, boolean anonymous) {
    }
}
