package tech.acecontext.platform.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;

import java.util.List;

/**
 * OAuth 2.0 Dynamic Client Registration.
 *
 * Registered clients are confidential and authenticate at the token
 * endpoint with client_secret_post or client_secret_basic.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7591">RFC 7591</a>
 */
@Path("/oauth/register")
@Tag(name = "OAuth2 Authorization")
public class ClientRegistrationResource {

    @Inject
    ClientRegistry clientRegistry;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Register an OAuth client")
    public Response register(RegistrationRequest request) {
        if (request == null) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Request body is required");
        }

        ClientRegistry.Registration registration =
            clientRegistry.registerClient(request.redirect_uris(), request.client_name());
        OAuthClient client = registration.client();

        return Response.ok(new RegistrationResponse(
            client.clientId,
            registration.clientSecret(),
            client.clientName,
            client.redirectUris,
            "client_secret_post",
            List.of(TokenGrant.AUTHORIZATION_CODE, TokenGrant.REFRESH_TOKEN),
            List.of("code"),
            client.createdAt.getEpochSecond(),
            0L
        )).header("Cache-Control", "no-store").build();
    }

    public record RegistrationRequest(List<String> redirect_uris, String client_name) {
    }

    /**
     * The client secret appears here and nowhere else.
     */
    public record RegistrationResponse(
        String client_id,
        String client_secret,
        String client_name,
        List<String> redirect_uris,
        String token_endpoint_auth_method,
        List<String> grant_types,
        List<String> response_types,
        long client_id_issued_at,
        long client_secret_expires_at
    ) {
    }
}
