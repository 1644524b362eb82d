package tech.acecontext.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.AuthConfig;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;
import tech.acecontext.platform.authentication.crypto.CryptoUtils;
import tech.acecontext.platform.authentication.federated.FederatedIdentityClient;
import tech.acecontext.platform.authentication.token.AuthorizationState;

import java.net.URI;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates authorization requests and hands the user agent to the
 * federated identity provider.
 *
 * Nothing is stored here. The request travels to the callback inside a
 * signed {@link AuthorizationState}.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);
    private static final int NONCE_BYTES = 16;

    /**
     * RFC 7636 Section 4.2: 43 to 128 unreserved characters.
     */
    private static final Pattern CODE_CHALLENGE = Pattern.compile("[A-Za-z0-9\\-._~]{43,128}");

    @Inject
    AuthConfig authConfig;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    FederatedIdentityClient federatedClient;

    /**
     * Validate an authorization request and build the provider redirect.
     *
     * Checks run in a fixed order and the first failure wins. An unknown
     * redirect URI is reported directly and never redirected to.
     *
     * @param codeChallengeMethod may be null, defaults to S256
     * @return the provider authorization URL
     * @throws OAuthException on any validation failure
     */
    public URI authorize(String responseType, String clientId, String redirectUri, String state,
                         String codeChallenge, String codeChallengeMethod) {
        if (!"code".equals(responseType)) {
            throw new OAuthException(OAuthError.UNSUPPORTED_RESPONSE_TYPE,
                "Only 'code' response type is supported");
        }

        if (clientId == null || clientId.isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "client_id is required");
        }
        OAuthClient client = clientRegistry.findClient(clientId)
            .orElseThrow(() -> {
                LOG.warnf("Authorization rejected: unknown client %s", clientId);
                return new OAuthException(OAuthError.INVALID_CLIENT, "Unknown client_id");
            });

        if (!client.isRedirectUriAllowed(redirectUri)) {
            LOG.warnf("Authorization rejected: redirect_uri not registered for client %s", clientId);
            throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri is not registered for this client");
        }

        if (codeChallenge == null || codeChallenge.isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "code_challenge is required");
        }
        if (!CODE_CHALLENGE.matcher(codeChallenge).matches()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST,
                "code_challenge must be 43 to 128 characters of [A-Za-z0-9-._~]");
        }

        String method = codeChallengeMethod == null || codeChallengeMethod.isEmpty()
            ? CodeChallengeMethod.S256.value()
            : codeChallengeMethod;
        if (CodeChallengeMethod.fromValue(method).isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "code_challenge_method must be S256 or plain");
        }

        Optional<String> secret = authConfig.serverSecret().filter(s -> !s.isBlank());
        if (!federatedClient.isConfigured() || secret.isEmpty()) {
            LOG.warn("Authorization rejected: identity provider or server secret not configured");
            throw new OAuthException(OAuthError.SERVER_ERROR, "Authorization server is not configured");
        }

        long now = Instant.now().getEpochSecond();
        AuthorizationState authState = new AuthorizationState(
            client.clientId,
            redirectUri,
            codeChallenge,
            method,
            state,
            now,
            now + authConfig.token().stateExpiry().toSeconds(),
            CryptoUtils.randomToken(NONCE_BYTES)
        );

        LOG.debugf("Redirecting authorization for client %s to identity provider", client.clientId);
        return URI.create(federatedClient.authorizationUrl(authState.seal(secret.get())));
    }
}
