package tech.acecontext.platform.authentication;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * JAX-RS exception mapper for {@link OAuthException}.
 *
 * Response format:
 * <pre>
 * {
 *   "error": "invalid_grant",
 *   "error_description": "Authorization code is invalid or expired"
 * }
 * </pre>
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

    @Override
    public Response toResponse(OAuthException exception) {
        OAuthError error = exception.getError();
        String description = exception.getDescription();
        var body = Map.of(
            "error", error.code(),
            "error_description", description != null ? description : error.code()
        );

        return Response.status(error.status())
            .type(MediaType.APPLICATION_JSON)
            .header("Cache-Control", "no-store")
            .header("Pragma", "no-cache")
            .entity(body)
            .build();
    }
}
