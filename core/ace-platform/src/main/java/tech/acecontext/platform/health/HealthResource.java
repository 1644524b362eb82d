package tech.acecontext.platform.health;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Liveness endpoint, also served at the root for simple uptime checks.
 */
@Path("/")
@Tag(name = "Health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    static final HealthStatus OK = new HealthStatus("ok", "ace-mcp", "2.0.0");

    @GET
    @Operation(summary = "Service status")
    public HealthStatus root() {
        return OK;
    }

    @GET
    @Path("health")
    @Operation(summary = "Service status")
    public HealthStatus health() {
        return OK;
    }

    public record HealthStatus(String status, String service, String version) {
    }
}
