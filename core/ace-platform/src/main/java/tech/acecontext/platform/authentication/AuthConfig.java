package tech.acecontext.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for the ACE authorization server.
 *
 * Example configuration:
 * <pre>
 * ace.auth.server-secret=${ACE_SERVER_SECRET}
 * ace.auth.external-base-url=https://ace.example.com
 * ace.auth.federated.client-id=1234.apps.googleusercontent.com
 * ace.auth.federated.client-secret=${GOOGLE_CLIENT_SECRET}
 * ace.auth.federated.redirect-uri=https://ace.example.com/oauth/callback
 *
 * # Optional statically trusted client
 * ace.auth.trusted-client.client-id=claude
 * ace.auth.trusted-client.client-secret=${CLAUDE_CLIENT_SECRET}
 * ace.auth.trusted-client.redirect-uris=https://claude.ai/api/mcp/auth_callback
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "ace.auth")
public interface AuthConfig {

    /**
     * HMAC secret used to sign state and access tokens.
     * Without it the server refuses to issue anything.
     */
    @WithName("server-secret")
    Optional<String> serverSecret();

    /**
     * Whether protected resources reject requests without a valid bearer token.
     */
    @WithDefault("true")
    boolean required();

    /**
     * Tenant used for requests that carry no valid token.
     * Only consulted when present.
     */
    @WithName("default-tenant-id")
    Optional<String> defaultTenantId();

    /**
     * Public URL of this server, used in discovery metadata and the
     * WWW-Authenticate challenge. Falls back to the request base URI.
     */
    @WithName("external-base-url")
    Optional<String> externalBaseUrl();

    /**
     * The single capability granted to every token.
     */
    @WithDefault("playbook")
    String scope();

    TokenConfig token();

    @WithName("trusted-client")
    TrustedClientConfig trustedClient();

    FederatedConfig federated();

    /**
     * Lifetimes of issued credentials.
     */
    interface TokenConfig {
        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        @WithName("refresh-token-expiry")
        @WithDefault("P30D")
        Duration refreshTokenExpiry();

        @WithName("authorization-code-expiry")
        @WithDefault("PT5M")
        Duration authorizationCodeExpiry();

        /**
         * Lifetime of the signed state carried through the federated provider.
         */
        @WithName("state-expiry")
        @WithDefault("PT5M")
        Duration stateExpiry();
    }

    /**
     * A client configured outside the registry.
     * Active only when both id and secret are set.
     */
    interface TrustedClientConfig {
        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        @WithName("redirect-uris")
        Optional<List<String>> redirectUris();
    }

    /**
     * The upstream identity provider. Defaults point at Google.
     */
    interface FederatedConfig {
        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        /**
         * Our callback as registered with the provider.
         */
        @WithName("redirect-uri")
        Optional<String> redirectUri();

        @WithName("authorization-endpoint")
        @WithDefault("https://accounts.google.com/o/oauth2/v2/auth")
        String authorizationEndpoint();

        @WithName("token-endpoint")
        @WithDefault("https://oauth2.googleapis.com/token")
        String tokenEndpoint();

        @WithName("userinfo-endpoint")
        @WithDefault("https://openidconnect.googleapis.com/v1/userinfo")
        String userinfoEndpoint();

        @WithDefault("openid email profile")
        String scopes();

        @WithName("connect-timeout")
        @WithDefault("PT10S")
        Duration connectTimeout();

        @WithName("request-timeout")
        @WithDefault("PT30S")
        Duration requestTimeout();
    }
}
