package tech.acecontext.platform.authentication.federated;

/**
 * Failure talking to the federated identity provider.
 * Terminal for the current login attempt; nothing is retried.
 */
public class FederatedLoginException extends Exception {

    public FederatedLoginException(String message) {
        super(message);
    }

    public FederatedLoginException(String message, Throwable cause) {
        super(message, cause);
    }
}
