package tech.acecontext.platform.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * OAuth2 endpoints for the federated authorization code flow with PKCE.
 *
 * <pre>
 * GET  /oauth/authorize  client request, redirected to the identity provider
 * GET  /oauth/callback   identity provider response, redirected back to the client
 * POST /oauth/token      code exchange and refresh token rotation
 * </pre>
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);

    @Inject
    AuthorizationService authorizationService;

    @Inject
    FederatedCallbackService callbackService;

    @Inject
    TokenEndpointService tokenEndpointService;

    // ==================== Authorization Endpoint ====================

    /**
     * OAuth2 Authorization endpoint.
     *
     * GET /oauth/authorize?
     *   response_type=code
     *   &client_id=oac_0HZXEQ5Y8JY5Z
     *   &redirect_uri=https://app.example/cb
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     *
     * Errors are returned as a JSON body, never as a redirect.
     */
    @GET
    @Path("/authorize")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Start authorization code flow")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "URI to redirect after authorization")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Client state, echoed back unchanged")
            @QueryParam("state") String state,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method (S256 or plain)")
            @QueryParam("code_challenge_method") @DefaultValue("S256") String codeChallengeMethod
    ) {
        URI providerUrl = authorizationService.authorize(
            responseType, clientId, redirectUri, state, codeChallenge, codeChallengeMethod);
        return Response.status(Response.Status.FOUND).location(providerUrl).build();
    }

    // ==================== Federated Callback ====================

    /**
     * Callback from the federated identity provider.
     * Failures are plain text; there is nothing safe to redirect to.
     */
    @GET
    @Path("/callback")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Federated identity provider callback")
    public Response callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error
    ) {
        try {
            URI clientRedirect = callbackService.handleCallback(error, code, state);
            return Response.status(Response.Status.FOUND).location(clientRedirect).build();
        } catch (OAuthException e) {
            return Response.status(e.getError().status())
                .type(MediaType.TEXT_PLAIN)
                .entity(e.getError().code() + ": " + e.getDescription())
                .build();
        }
    }

    // ==================== Token Endpoint ====================

    /**
     * OAuth2 Token endpoint.
     *
     * Client credentials come from the form (client_secret_post) or an
     * HTTP Basic header (client_secret_basic).
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange an authorization code or refresh token for tokens")
    public Response token(
            @HeaderParam("Authorization") String authHeader,

            @Parameter(description = "authorization_code or refresh_token")
            @FormParam("grant_type") String grantType,

            @FormParam("code") String code,

            @FormParam("redirect_uri") String redirectUri,

            @FormParam("client_id") String formClientId,

            @FormParam("client_secret") String formClientSecret,

            @FormParam("code_verifier") String codeVerifier,

            @FormParam("refresh_token") String refreshToken
    ) {
        String clientId = formClientId;
        String clientSecret = formClientSecret;
        if (authHeader != null && authHeader.regionMatches(true, 0, "Basic ", 0, 6)) {
            String[] credentials = parseBasicAuth(authHeader);
            clientId = credentials[0];
            clientSecret = credentials[1];
        }

        TokenResponse tokens = tokenEndpointService.exchange(
            clientId, clientSecret, grantType, code, redirectUri, codeVerifier, refreshToken);

        return Response.ok(tokens)
            .header("Cache-Control", "no-store")
            .header("Pragma", "no-cache")
            .build();
    }

    /**
     * Decode {@code Basic base64(urlencode(id):urlencode(secret))}.
     *
     * @throws OAuthException invalid_client when the header cannot be decoded
     */
    private String[] parseBasicAuth(String authHeader) {
        try {
            String base64 = authHeader.substring("Basic ".length()).trim();
            String decoded = new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
            int colonIdx = decoded.indexOf(':');
            if (colonIdx < 0) {
                throw new IllegalArgumentException("Missing ':' separator");
            }
            return new String[] {
                URLDecoder.decode(decoded.substring(0, colonIdx), StandardCharsets.UTF_8),
                URLDecoder.decode(decoded.substring(colonIdx + 1), StandardCharsets.UTF_8)
            };
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejecting token request: malformed Basic authorization header");
            throw new OAuthException(OAuthError.INVALID_CLIENT, "Malformed Basic authorization header");
        }
    }
}
