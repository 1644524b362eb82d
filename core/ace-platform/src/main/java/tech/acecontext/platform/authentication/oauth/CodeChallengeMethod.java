package tech.acecontext.platform.authentication.oauth;

import java.util.Optional;

/**
 * PKCE code challenge methods accepted at the authorization endpoint.
 */
public enum CodeChallengeMethod {

    S256("S256"),
    PLAIN("plain");

    private final String value;

    CodeChallengeMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Exact, case-sensitive lookup of the wire value.
     */
    public static Optional<CodeChallengeMethod> fromValue(String value) {
        for (CodeChallengeMethod method : values()) {
            if (method.value.equals(value)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
