package tech.acecontext.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.AuthConfig;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;
import tech.acecontext.platform.authentication.crypto.CryptoUtils;
import tech.acecontext.platform.authentication.federated.FederatedIdentity;
import tech.acecontext.platform.authentication.federated.FederatedIdentityClient;
import tech.acecontext.platform.authentication.federated.FederatedLoginException;
import tech.acecontext.platform.authentication.token.AuthorizationState;
import tech.acecontext.platform.authentication.token.InvalidTokenException;
import tech.acecontext.platform.tenant.Tenant;
import tech.acecontext.platform.tenant.TenantService;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Completes a federated login and hands an authorization code back to the client.
 *
 * Flow:
 * 1. Recover the original request from the signed state
 * 2. Exchange the provider code for the user's identity
 * 3. Provision the tenant for that identity
 * 4. Mint a single-use authorization code bound to the PKCE challenge
 * 5. Redirect to the client's redirect_uri with code and original state
 *
 * No transaction spans the provider call. Tenant provisioning and the code
 * insert each commit on their own.
 */
@ApplicationScoped
public class FederatedCallbackService {

    private static final Logger LOG = Logger.getLogger(FederatedCallbackService.class);
    private static final int CODE_BYTES = 32;

    @Inject
    AuthConfig authConfig;

    @Inject
    FederatedIdentityClient federatedClient;

    @Inject
    TenantService tenantService;

    @Inject
    AuthorizationCodeRepository codeRepo;

    /**
     * Handle the provider's redirect.
     *
     * @param providerError {@code error} parameter sent by the provider, if any
     * @return where to send the user agent
     * @throws OAuthException invalid_request or invalid_state (400), server_error (500)
     */
    public URI handleCallback(String providerError, String providerCode, String state) {
        if (providerError != null && !providerError.isEmpty()) {
            LOG.infof("Identity provider returned error: %s", providerError);
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Identity provider returned error: " + providerError);
        }
        if (providerCode == null || providerCode.isEmpty() || state == null || state.isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Missing code or state");
        }

        String secret = authConfig.serverSecret()
            .filter(s -> !s.isBlank())
            .orElseThrow(() -> new OAuthException(OAuthError.SERVER_ERROR, "Server signing secret is not configured"));

        AuthorizationState authState;
        try {
            authState = AuthorizationState.open(state, secret);
        } catch (InvalidTokenException e) {
            LOG.warnf("Callback rejected: state verification failed (%s)", e.getReason());
            throw new OAuthException(OAuthError.INVALID_STATE, "Invalid or expired state");
        }

        FederatedIdentity identity;
        try {
            identity = federatedClient.exchange(providerCode);
        } catch (FederatedLoginException e) {
            LOG.warnf(e, "Federated login failed for client %s", authState.clientId());
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Federated login failed: " + e.getMessage());
        }

        Tenant tenant = tenantService.provision(identity);

        Instant now = Instant.now();
        AuthorizationCode authCode = new AuthorizationCode();
        authCode.code = CryptoUtils.randomToken(CODE_BYTES);
        authCode.clientId = authState.clientId();
        authCode.redirectUri = authState.redirectUri();
        authCode.tenantId = tenant.id;
        authCode.codeChallenge = authState.codeChallenge();
        authCode.codeChallengeMethod = authState.codeChallengeMethod();
        authCode.createdAt = now;
        authCode.expiresAt = now.plus(authConfig.token().authorizationCodeExpiry());
        codeRepo.persist(authCode);

        LOG.infof("Authorization code issued to client %s for tenant %s", authCode.clientId, tenant.id);
        return buildClientRedirect(authState.redirectUri(), authCode.code, authState.originalState());
    }

    private URI buildClientRedirect(String redirectUri, String code, String originalState) {
        StringBuilder url = new StringBuilder(redirectUri);
        url.append(redirectUri.contains("?") ? "&" : "?");
        url.append("code=").append(urlEncode(code));
        if (originalState != null) {
            url.append("&state=").append(urlEncode(originalState));
        }
        return URI.create(url.toString());
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
