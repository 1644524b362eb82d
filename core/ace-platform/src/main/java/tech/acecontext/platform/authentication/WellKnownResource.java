package tech.acecontext.platform.authentication;

import jakarta.inject.Inject;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Well-known endpoints for OAuth2 discovery.
 *
 * Both documents are also served under any path suffix, since clients
 * build the URL from the resource they are trying to reach
 * (e.g. /.well-known/oauth-protected-resource/mcp).
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8414">RFC 8414</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc9728">RFC 9728</a>
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "OAuth2 discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    @Inject
    AuthConfig authConfig;

    @Context
    UriInfo uriInfo;

    /**
     * Authorization server metadata.
     */
    @GET
    @Path("/oauth-authorization-server")
    @Operation(summary = "Get OAuth2 authorization server metadata")
    @APIResponse(responseCode = "200", description = "Authorization server metadata")
    public JsonObject authorizationServer() {
        String baseUrl = ExternalBaseUrl.resolve(authConfig, uriInfo);
        return Json.createObjectBuilder()
            .add("issuer", baseUrl)
            .add("authorization_endpoint", baseUrl + "/oauth/authorize")
            .add("token_endpoint", baseUrl + "/oauth/token")
            .add("registration_endpoint", baseUrl + "/oauth/register")
            .add("response_types_supported", Json.createArrayBuilder().add("code"))
            .add("grant_types_supported", Json.createArrayBuilder()
                .add("authorization_code")
                .add("refresh_token"))
            .add("token_endpoint_auth_methods_supported", Json.createArrayBuilder()
                .add("client_secret_post")
                .add("client_secret_basic"))
            .add("code_challenge_methods_supported", Json.createArrayBuilder()
                .add("S256")
                .add("plain"))
            .add("scopes_supported", Json.createArrayBuilder().add(authConfig.scope()))
            .build();
    }

    @GET
    @Path("/oauth-authorization-server/{suffix: .+}")
    @Operation(summary = "Get OAuth2 authorization server metadata for a resource path")
    public JsonObject authorizationServerForPath() {
        return authorizationServer();
    }

    /**
     * Protected resource metadata.
     */
    @GET
    @Path("/oauth-protected-resource")
    @Operation(summary = "Get OAuth2 protected resource metadata")
    @APIResponse(responseCode = "200", description = "Protected resource metadata")
    public JsonObject protectedResource() {
        String baseUrl = ExternalBaseUrl.resolve(authConfig, uriInfo);
        return Json.createObjectBuilder()
            .add("resource", baseUrl)
            .add("authorization_servers", Json.createArrayBuilder().add(baseUrl))
            .add("bearer_methods_supported", Json.createArrayBuilder().add("header"))
            .add("scopes_supported", Json.createArrayBuilder().add(authConfig.scope()))
            .build();
    }

    @GET
    @Path("/oauth-protected-resource/{suffix: .+}")
    @Operation(summary = "Get OAuth2 protected resource metadata for a resource path")
    public JsonObject protectedResourceForPath() {
        return protectedResource();
    }
}
