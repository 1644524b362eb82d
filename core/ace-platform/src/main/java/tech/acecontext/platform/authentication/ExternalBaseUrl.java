package tech.acecontext.platform.authentication;

import jakarta.ws.rs.core.UriInfo;

/**
 * Resolves the public base URL used in discovery documents and challenges.
 */
public final class ExternalBaseUrl {

    private ExternalBaseUrl() {
    }

    /**
     * {@code ace.auth.external-base-url} when set, else the request base URI.
     * Never ends with a slash.
     */
    public static String resolve(AuthConfig authConfig, UriInfo uriInfo) {
        return authConfig.externalBaseUrl()
            .filter(url -> !url.isBlank())
            .orElseGet(() -> uriInfo.getBaseUri().toString())
            .replaceAll("/+$", "");
    }
}
