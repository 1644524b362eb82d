package tech.acecontext.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.AuthConfig;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;
import tech.acecontext.platform.authentication.crypto.CryptoUtils;
import tech.acecontext.platform.authentication.token.AccessTokenService;
import tech.acecontext.platform.tenant.TenantService;

import java.time.Instant;

/**
 * Token endpoint logic: authorization code exchange and refresh token rotation.
 *
 * The client is always authenticated before the grant is even parsed.
 * Codes and refresh tokens are removed with a conditional delete before
 * anything is issued, so of two concurrent redemptions exactly one wins.
 */
@ApplicationScoped
public class TokenEndpointService {

    private static final Logger LOG = Logger.getLogger(TokenEndpointService.class);
    private static final int REFRESH_TOKEN_BYTES = 32;

    @Inject
    AuthConfig authConfig;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    RefreshTokenRepository refreshTokenRepo;

    @Inject
    PkceService pkceService;

    @Inject
    AccessTokenService accessTokenService;

    @Inject
    TenantService tenantService;

    /**
     * Handle a token request.
     *
     * @throws OAuthException invalid_client, invalid_request, invalid_grant or unsupported_grant_type
     */
    @Transactional
    public TokenResponse exchange(String clientId, String clientSecret, String grantType, String code,
                                  String redirectUri, String codeVerifier, String refreshToken) {
        OAuthClient client = clientRegistry.authenticate(clientId, clientSecret);

        TokenGrant grant = TokenGrant.parse(grantType, code, redirectUri, codeVerifier, refreshToken);
        if (grant instanceof TokenGrant.AuthorizationCodeGrant codeGrant) {
            return exchangeAuthorizationCode(client, codeGrant);
        }
        if (grant instanceof TokenGrant.RefreshTokenGrant refreshGrant) {
            return rotateRefreshToken(client, refreshGrant);
        }
        throw new IllegalStateException("Unhandled grant " + grant.getClass().getSimpleName());
    }

    // ==================== Authorization Code Grant ====================

    private TokenResponse exchangeAuthorizationCode(OAuthClient client, TokenGrant.AuthorizationCodeGrant grant) {
        AuthorizationCode authCode = codeRepo.findByCode(grant.code())
            .orElseThrow(() -> invalidGrant(client, "Authorization code is invalid or expired"));

        if (!authCode.clientId.equals(client.clientId)) {
            throw invalidGrant(client, "Authorization code was issued to a different client");
        }
        if (!authCode.redirectUri.equals(grant.redirectUri())) {
            throw invalidGrant(client, "redirect_uri does not match the authorization request");
        }
        if (authCode.isExpired()) {
            throw invalidGrant(client, "Authorization code is invalid or expired");
        }

        if (!pkceService.verifyCodeChallenge(grant.codeVerifier(), authCode.codeChallenge,
                authCode.codeChallengeMethod)) {
            throw invalidGrant(client, "PKCE verification failed");
        }

        if (!codeRepo.consume(authCode.code)) {
            throw invalidGrant(client, "Authorization code has already been used");
        }

        TokenResponse response = issueTokens(client, authCode.tenantId);
        LOG.infof("Tokens issued for tenant %s to client %s via authorization_code grant",
            authCode.tenantId, client.clientId);
        return response;
    }

    // ==================== Refresh Token Grant ====================

    private TokenResponse rotateRefreshToken(OAuthClient client, TokenGrant.RefreshTokenGrant grant) {
        String tokenHash = CryptoUtils.sha256Base64Url(grant.refreshToken());

        RefreshToken stored = refreshTokenRepo.findByTokenHash(tokenHash)
            .orElseThrow(() -> invalidGrant(client, "Refresh token is invalid or expired"));

        if (!stored.clientId.equals(client.clientId)) {
            throw invalidGrant(client, "Refresh token was issued to a different client");
        }
        if (stored.isExpired()) {
            throw invalidGrant(client, "Refresh token is invalid or expired");
        }

        if (!refreshTokenRepo.deleteByTokenHash(tokenHash)) {
            throw invalidGrant(client, "Refresh token has already been used");
        }

        TokenResponse response = issueTokens(client, stored.tenantId);
        LOG.infof("Tokens refreshed for tenant %s by client %s", stored.tenantId, client.clientId);
        return response;
    }

    // ==================== Issuance ====================

    private TokenResponse issueTokens(OAuthClient client, String tenantId) {
        String email = tenantService.find(tenantId).map(t -> t.email).orElse(null);
        String accessToken = accessTokenService.issue(tenantId, email);

        String refreshToken = CryptoUtils.randomToken(REFRESH_TOKEN_BYTES);
        Instant now = Instant.now();
        RefreshToken issued = new RefreshToken();
        issued.tokenHash = CryptoUtils.sha256Base64Url(refreshToken);
        issued.tenantId = tenantId;
        issued.clientId = client.clientId;
        issued.createdAt = now;
        issued.expiresAt = now.plus(authConfig.token().refreshTokenExpiry());
        refreshTokenRepo.persist(issued);

        return TokenResponse.bearer(accessToken, accessTokenService.expiresInSeconds(), refreshToken,
            accessTokenService.scope());
    }

    private OAuthException invalidGrant(OAuthClient client, String description) {
        LOG.warnf("Token request rejected for client %s: %s", client.clientId, description);
        return new OAuthException(OAuthError.INVALID_GRANT, description);
    }
}
