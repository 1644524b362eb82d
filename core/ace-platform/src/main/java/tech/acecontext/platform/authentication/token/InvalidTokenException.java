package tech.acecontext.platform.authentication.token;

/**
 * Thrown when a signed token fails verification.
 *
 * The {@link Reason} is for diagnostics only. Callers must treat every
 * reason the same way so verification does not become an oracle.
 */
public class InvalidTokenException extends Exception {

    public enum Reason {
        MALFORMED,
        INVALID_SIGNATURE,
        EXPIRED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
