package tech.acecontext.platform.authentication;

/**
 * A terminal OAuth failure for the current call.
 *
 * Rendered by {@link OAuthExceptionMapper}. The description is sent to the
 * client, so it must never contain secret material.
 */
public class OAuthException extends RuntimeException {

    private final OAuthError error;

    public OAuthException(OAuthError error, String description) {
        super(description);
        this.error = error;
    }

    public OAuthError getError() {
        return error;
    }

    public String getDescription() {
        return getMessage();
    }
}
