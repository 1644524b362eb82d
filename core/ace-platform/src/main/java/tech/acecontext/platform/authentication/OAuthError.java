package tech.acecontext.platform.authentication;

import jakarta.ws.rs.core.Response;

/**
 * OAuth2 error codes returned in the {@code {error, error_description}} envelope.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-5.2">RFC 6749 Section 5.2</a>
 */
public enum OAuthError {

    INVALID_REQUEST("invalid_request", Response.Status.BAD_REQUEST),
    INVALID_CLIENT("invalid_client", Response.Status.UNAUTHORIZED),
    INVALID_GRANT("invalid_grant", Response.Status.BAD_REQUEST),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", Response.Status.BAD_REQUEST),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", Response.Status.BAD_REQUEST),
    INVALID_STATE("invalid_state", Response.Status.BAD_REQUEST),
    SERVER_ERROR("server_error", Response.Status.INTERNAL_SERVER_ERROR);

    private final String code;
    private final Response.Status status;

    OAuthError(String code, Response.Status status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public Response.Status status() {
        return status;
    }
}
