package tech.acecontext.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.AuthConfig;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;
import tech.acecontext.platform.authentication.crypto.CryptoUtils;
import tech.acecontext.platform.shared.EntityType;
import tech.acecontext.platform.shared.TsidGenerator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Registers and authenticates confidential OAuth clients.
 *
 * Two kinds of client exist:
 * - the trusted client from {@code ace.auth.trusted-client.*}, never stored
 * - dynamically registered clients, stored with only a digest of their secret
 *
 * Both are authenticated the same way: constant-time comparison of
 * SHA-256 digests of the presented and expected secrets.
 */
@ApplicationScoped
public class ClientRegistry {

    private static final Logger LOG = Logger.getLogger(ClientRegistry.class);
    private static final int SECRET_BYTES = 32;
    static final int MAX_CLIENT_NAME_LENGTH = 200;
    static final int MAX_REDIRECT_URI_LENGTH = 2000;

    @Inject
    AuthConfig authConfig;

    @Inject
    OAuthClientRepository clientRepo;

    /**
     * Result of a registration. The plaintext secret is only ever available here.
     */
    public record Registration(OAuthClient client, String clientSecret) {
    }

    /**
     * Register a new client.
     *
     * @throws OAuthException invalid_request when no redirect URI is given, one is not an
     *                        absolute URI without fragment, or a value exceeds its stored length
     */
    @Transactional
    public Registration registerClient(List<String> redirectUris, String clientName) {
        List<String> validated = validateRedirectUris(redirectUris);
        if (clientName != null && clientName.length() > MAX_CLIENT_NAME_LENGTH) {
            throw new OAuthException(OAuthError.INVALID_REQUEST,
                "client_name must not exceed " + MAX_CLIENT_NAME_LENGTH + " characters");
        }

        String clientSecret = CryptoUtils.randomToken(SECRET_BYTES);

        OAuthClient client = new OAuthClient();
        client.clientId = TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        client.clientName = clientName;
        client.secretHash = CryptoUtils.sha256Base64Url(clientSecret);
        client.redirectUris = validated;
        client.createdAt = Instant.now();
        clientRepo.persist(client);

        LOG.infof("Registered OAuth client %s (%s) with %d redirect URI(s)",
            client.clientId, clientName, validated.size());
        return new Registration(client, clientSecret);
    }

    /**
     * Find a client by id, checking the trusted client before the registry.
     */
    public Optional<OAuthClient> findClient(String clientId) {
        if (clientId == null || clientId.isEmpty()) {
            return Optional.empty();
        }
        Optional<OAuthClient> trusted = trustedClient()
            .filter(client -> CryptoUtils.constantTimeEquals(client.clientId, clientId));
        if (trusted.isPresent()) {
            return trusted;
        }
        return clientRepo.findByClientId(clientId);
    }

    /**
     * Authenticate a client by id and secret.
     *
     * @return the authenticated client
     * @throws OAuthException invalid_client on any failure
     */
    public OAuthClient authenticate(String clientId, String clientSecret) {
        if (clientId == null || clientId.isEmpty() || clientSecret == null || clientSecret.isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_CLIENT, "Client authentication required");
        }

        String presentedHash = CryptoUtils.sha256Base64Url(clientSecret);

        Optional<OAuthClient> trusted = trustedClient();
        if (trusted.isPresent()
                && CryptoUtils.constantTimeEquals(trusted.get().clientId, clientId)
                && CryptoUtils.constantTimeEquals(trusted.get().secretHash, presentedHash)) {
            return trusted.get();
        }

        Optional<OAuthClient> registered = clientRepo.findByClientId(clientId);
        if (registered.isEmpty()) {
            LOG.warnf("Client authentication failed: unknown client %s", clientId);
            throw new OAuthException(OAuthError.INVALID_CLIENT, "Invalid client credentials");
        }
        if (!CryptoUtils.constantTimeEquals(registered.get().secretHash, presentedHash)) {
            LOG.warnf("Client authentication failed: bad secret for client %s", clientId);
            throw new OAuthException(OAuthError.INVALID_CLIENT, "Invalid client credentials");
        }
        return registered.get();
    }

    private Optional<OAuthClient> trustedClient() {
        AuthConfig.TrustedClientConfig config = authConfig.trustedClient();
        Optional<String> id = config.clientId().filter(s -> !s.isBlank());
        Optional<String> secret = config.clientSecret().filter(s -> !s.isBlank());
        if (id.isEmpty() || secret.isEmpty()) {
            return Optional.empty();
        }

        OAuthClient client = new OAuthClient();
        client.clientId = id.get();
        client.clientName = "trusted";
        client.secretHash = CryptoUtils.sha256Base64Url(secret.get());
        client.redirectUris = new ArrayList<>(config.redirectUris().orElse(List.of()));
        return Optional.of(client);
    }

    private List<String> validateRedirectUris(List<String> redirectUris) {
        if (redirectUris == null || redirectUris.isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uris is required");
        }
        List<String> validated = new ArrayList<>();
        for (String redirectUri : redirectUris) {
            if (redirectUri == null || redirectUri.isBlank()) {
                throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uris must not contain blank values");
            }
            if (redirectUri.length() > MAX_REDIRECT_URI_LENGTH) {
                throw new OAuthException(OAuthError.INVALID_REQUEST,
                    "redirect_uris must not exceed " + MAX_REDIRECT_URI_LENGTH + " characters");
            }
            try {
                URI uri = new URI(redirectUri);
                if (!uri.isAbsolute()) {
                    throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uris must be absolute URIs");
                }
                // RFC 6749 Section 3.1.2
                if (uri.getRawFragment() != null) {
                    throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uris must not contain a fragment");
                }
            } catch (URISyntaxException e) {
                throw new OAuthException(OAuthError.INVALID_REQUEST, "Invalid redirect URI: " + e.getReason());
            }
            if (!validated.contains(redirectUri)) {
                validated.add(redirectUri);
            }
        }
        return validated;
    }
}
