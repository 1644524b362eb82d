package tech.acecontext.platform.authentication.federated;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.AuthConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Server-to-server calls to the federated identity provider (Google by default).
 *
 * The provider code is exchanged at the token endpoint, then the userinfo
 * endpoint is read with the provider's access token. Any failure ends the
 * login attempt; there is no retry.
 */
@ApplicationScoped
public class FederatedIdentityClient {

    private static final Logger LOG = Logger.getLogger(FederatedIdentityClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    AuthConfig authConfig;

    private HttpClient httpClient;

    @PostConstruct
    void init() {
        httpClient = HttpClient.newBuilder()
            .connectTimeout(authConfig.federated().connectTimeout())
            .build();
    }

    /**
     * Whether the provider client id, secret and our callback URI are all configured.
     */
    public boolean isConfigured() {
        AuthConfig.FederatedConfig config = authConfig.federated();
        return isSet(config.clientId().orElse(null))
            && isSet(config.clientSecret().orElse(null))
            && isSet(config.redirectUri().orElse(null));
    }

    /**
     * Build the provider authorization URL carrying our signed state.
     * Requests offline access and forces the consent screen.
     */
    public String authorizationUrl(String state) {
        AuthConfig.FederatedConfig config = authConfig.federated();
        StringBuilder url = new StringBuilder(config.authorizationEndpoint());
        url.append(config.authorizationEndpoint().contains("?") ? "&" : "?");
        url.append("response_type=code");
        url.append("&client_id=").append(urlEncode(config.clientId().orElseThrow()));
        url.append("&redirect_uri=").append(urlEncode(config.redirectUri().orElseThrow()));
        url.append("&scope=").append(urlEncode(config.scopes()));
        url.append("&state=").append(urlEncode(state));
        url.append("&access_type=offline");
        url.append("&prompt=consent");
        return url.toString();
    }

    /**
     * Exchange the provider's authorization code for the user's identity.
     *
     * @throws FederatedLoginException on transport failure, a non-200 status,
     *                                 or a response without a subject
     */
    public FederatedIdentity exchange(String providerCode) throws FederatedLoginException {
        if (!isConfigured()) {
            throw new FederatedLoginException("Federated identity provider is not configured");
        }
        String providerAccessToken = exchangeCode(providerCode);
        return fetchUserInfo(providerAccessToken);
    }

    // ==================== Token Exchange ====================

    private String exchangeCode(String providerCode) throws FederatedLoginException {
        AuthConfig.FederatedConfig config = authConfig.federated();

        StringBuilder body = new StringBuilder();
        body.append("grant_type=authorization_code");
        body.append("&code=").append(urlEncode(providerCode));
        body.append("&client_id=").append(urlEncode(config.clientId().orElseThrow()));
        body.append("&client_secret=").append(urlEncode(config.clientSecret().orElseThrow()));
        body.append("&redirect_uri=").append(urlEncode(config.redirectUri().orElseThrow()));

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(config.tokenEndpoint()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
            .timeout(config.requestTimeout())
            .build();

        JsonNode json = send(request, "token");
        String accessToken = json.path("access_token").asText(null);
        if (accessToken == null || accessToken.isEmpty()) {
            throw new FederatedLoginException("No access token received from identity provider");
        }
        return accessToken;
    }

    // ==================== User Info ====================

    private FederatedIdentity fetchUserInfo(String providerAccessToken) throws FederatedLoginException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(authConfig.federated().userinfoEndpoint()))
            .header("Authorization", "Bearer " + providerAccessToken)
            .header("Accept", "application/json")
            .GET()
            .timeout(authConfig.federated().requestTimeout())
            .build();

        JsonNode json = send(request, "userinfo");
        String subject = json.path("sub").asText(null);
        if (subject == null || subject.isEmpty()) {
            throw new FederatedLoginException("No subject claim in userinfo response");
        }
        String email = json.path("email").asText(null);
        return new FederatedIdentity(subject, email);
    }

    private JsonNode send(HttpRequest request, String endpointName) throws FederatedLoginException {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                // Body may echo credentials, log the status only
                LOG.warnf("Identity provider %s endpoint returned %d", endpointName, response.statusCode());
                throw new FederatedLoginException(
                    "Identity provider " + endpointName + " request failed with status " + response.statusCode());
            }
            return MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new FederatedLoginException("Identity provider " + endpointName + " request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FederatedLoginException("Interrupted calling identity provider " + endpointName, e);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
