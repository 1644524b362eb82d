package tech.acecontext.platform.authentication.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.acecontext.platform.authentication.AuthenticatedPrincipal;
import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;
import tech.acecontext.platform.authentication.crypto.CryptoUtils;
import tech.acecontext.platform.authentication.federated.FederatedIdentity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TokenEndpointService.
 */
class TokenEndpointServiceTest {

    private static final String REDIRECT_URI = "https://app.example/cb";
    private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
    private static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";
    private static final String TENANT_ID = "google-sub-1";

    private OAuthTestHarness harness;
    private TokenEndpointService service;
    private String clientId;
    private String clientSecret;

    @BeforeEach
    void setUp() {
        harness = new OAuthTestHarness();
        service = harness.tokenEndpointService;

        ClientRegistry.Registration registration =
            harness.clientRegistry.registerClient(List.of(REDIRECT_URI), "test");
        clientId = registration.client().clientId;
        clientSecret = registration.clientSecret();

        harness.tenantService.provision(new FederatedIdentity(TENANT_ID, "ada@example.com"));
    }

    private AuthorizationCode storeCode(String code, String forClient, Instant expiresAt) {
        AuthorizationCode authCode = new AuthorizationCode();
        authCode.code = code;
        authCode.clientId = forClient;
        authCode.redirectUri = REDIRECT_URI;
        authCode.tenantId = TENANT_ID;
        authCode.codeChallenge = CHALLENGE;
        authCode.codeChallengeMethod = "S256";
        authCode.createdAt = Instant.now();
        authCode.expiresAt = expiresAt;
        harness.codeRepo.persist(authCode);
        return authCode;
    }

    private AuthorizationCode storeCode(String code) {
        return storeCode(code, clientId, Instant.now().plusSeconds(300));
    }

    private TokenResponse redeem(String code, String redirectUri, String verifier) {
        return service.exchange(clientId, clientSecret, "authorization_code", code, redirectUri, verifier, null);
    }

    private TokenResponse refresh(String refreshToken) {
        return service.exchange(clientId, clientSecret, "refresh_token", null, null, null, refreshToken);
    }

    private static void assertError(Throwable thrown, OAuthError expected) {
        assertThat(thrown).isInstanceOfSatisfying(OAuthException.class,
            e -> assertThat(e.getError()).isEqualTo(expected));
    }

    // ========================================
    // client authentication TESTS
    // ========================================

    @Nested
    @DisplayName("client authentication")
    class ClientAuthentication {

        @Test
        @DisplayName("exchange should reject a wrong secret before looking at the grant")
        void exchange_shouldThrowInvalidClient_whenSecretWrong() {
            storeCode("code-1");

            Throwable thrown = catchThrowable(() -> service.exchange(
                clientId, "wrong", "authorization_code", "code-1", REDIRECT_URI, VERIFIER, null));

            assertError(thrown, OAuthError.INVALID_CLIENT);
            assertThat(harness.codeRepo.findByCode("code-1")).isPresent();
        }

        @Test
        @DisplayName("exchange should report invalid_client even for an unsupported grant type")
        void exchange_shouldThrowInvalidClient_whenGrantTypeAlsoInvalid() {
            Throwable thrown = catchThrowable(() -> service.exchange(
                clientId, null, "password", null, null, null, null));

            assertError(thrown, OAuthError.INVALID_CLIENT);
        }

        @Test
        @DisplayName("exchange should report unsupported_grant_type for an authenticated client")
        void exchange_shouldThrowUnsupportedGrantType_whenGrantTypeUnknown() {
            Throwable thrown = catchThrowable(() -> service.exchange(
                clientId, clientSecret, "password", null, null, null, null));

            assertError(thrown, OAuthError.UNSUPPORTED_GRANT_TYPE);
        }
    }

    // ========================================
    // authorization_code TESTS
    // ========================================

    @Nested
    @DisplayName("authorization_code grant")
    class AuthorizationCodeExchange {

        @Test
        @DisplayName("exchange should issue bearer tokens for a valid code and verifier")
        void exchange_shouldIssueTokens_whenCodeAndVerifierValid() {
            storeCode("code-1");

            TokenResponse response = redeem("code-1", REDIRECT_URI, VERIFIER);

            assertThat(response.token_type()).isEqualTo("Bearer");
            assertThat(response.expires_in()).isEqualTo(3600);
            assertThat(response.scope()).isEqualTo("playbook");
            assertThat(response.refresh_token()).isNotBlank();

            AuthenticatedPrincipal principal = harness.accessTokenService.verify(response.access_token()).orElseThrow();
            assertThat(principal.tenantId()).isEqualTo(TENANT_ID);
            assertThat(principal.email()).isEqualTo("ada@example.com");

            RefreshToken stored = harness.refreshTokenRepo
                .findByTokenHash(CryptoUtils.sha256Base64Url(response.refresh_token())).orElseThrow();
            assertThat(stored.clientId).isEqualTo(clientId);
            assertThat(stored.tenantId).isEqualTo(TENANT_ID);
            assertThat(Duration.between(Instant.now(), stored.expiresAt).toDays()).isBetween(29L, 30L);
        }

        @Test
        @DisplayName("exchange should never store the refresh token in plaintext")
        void exchange_shouldStoreOnlyRefreshTokenDigest() {
            storeCode("code-1");

            TokenResponse response = redeem("code-1", REDIRECT_URI, VERIFIER);

            assertThat(harness.refreshTokenRepo.findByTokenHash(response.refresh_token())).isEmpty();
        }

        @Test
        @DisplayName("exchange should reject a code that is replayed")
        void exchange_shouldThrowInvalidGrant_whenCodeReplayed() {
            storeCode("code-1");
            redeem("code-1", REDIRECT_URI, VERIFIER);

            Throwable thrown = catchThrowable(() -> redeem("code-1", REDIRECT_URI, VERIFIER));

            assertError(thrown, OAuthError.INVALID_GRANT);
            assertThat(harness.refreshTokenRepo.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("exchange should reject an unknown code")
        void exchange_shouldThrowInvalidGrant_whenCodeUnknown() {
            assertError(catchThrowable(() -> redeem("nope", REDIRECT_URI, VERIFIER)), OAuthError.INVALID_GRANT);
        }

        @Test
        @DisplayName("exchange should reject a code issued to another client")
        void exchange_shouldThrowInvalidGrant_whenCodeBelongsToOtherClient() {
            storeCode("code-1", "oac_someoneelse", Instant.now().plusSeconds(300));

            assertError(catchThrowable(() -> redeem("code-1", REDIRECT_URI, VERIFIER)), OAuthError.INVALID_GRANT);
            assertThat(harness.codeRepo.findByCode("code-1")).isPresent();
        }

        @Test
        @DisplayName("exchange should reject a redirect_uri that differs from the authorization request")
        void exchange_shouldThrowInvalidGrant_whenRedirectUriDiffers() {
            storeCode("code-1");

            assertError(catchThrowable(() -> redeem("code-1", REDIRECT_URI + "/", VERIFIER)), OAuthError.INVALID_GRANT);
        }

        @Test
        @DisplayName("exchange should reject an expired code")
        void exchange_shouldThrowInvalidGrant_whenCodeExpired() {
            storeCode("code-1", clientId, Instant.now().minusSeconds(1));

            assertError(catchThrowable(() -> redeem("code-1", REDIRECT_URI, VERIFIER)), OAuthError.INVALID_GRANT);
        }

        @Test
        @DisplayName("exchange should reject a wrong PKCE verifier and keep the code")
        void exchange_shouldThrowInvalidGrant_whenVerifierWrong() {
            storeCode("code-1");

            assertError(catchThrowable(() -> redeem("code-1", REDIRECT_URI, VERIFIER + "x")), OAuthError.INVALID_GRANT);
            assertThat(harness.refreshTokenRepo.size()).isZero();
        }

        @Test
        @DisplayName("exchange should require code, redirect_uri and code_verifier")
        void exchange_shouldThrowInvalidRequest_whenParametersMissing() {
            storeCode("code-1");

            assertError(catchThrowable(() -> redeem(null, REDIRECT_URI, VERIFIER)), OAuthError.INVALID_REQUEST);
            assertError(catchThrowable(() -> redeem("code-1", null, VERIFIER)), OAuthError.INVALID_REQUEST);
            assertError(catchThrowable(() -> redeem("code-1", REDIRECT_URI, null)), OAuthError.INVALID_REQUEST);
        }
    }

    // ========================================
    // refresh_token TESTS
    // ========================================

    @Nested
    @DisplayName("refresh_token grant")
    class RefreshTokenRotation {

        @Test
        @DisplayName("exchange should rotate the refresh token")
        void exchange_shouldRotateRefreshToken() {
            storeCode("code-1");
            TokenResponse first = redeem("code-1", REDIRECT_URI, VERIFIER);

            TokenResponse second = refresh(first.refresh_token());

            assertThat(second.refresh_token()).isNotEqualTo(first.refresh_token());
            assertThat(harness.accessTokenService.verify(second.access_token()))
                .hasValueSatisfying(p -> assertThat(p.tenantId()).isEqualTo(TENANT_ID));
            assertThat(harness.refreshTokenRepo.size()).isEqualTo(1);

            assertError(catchThrowable(() -> refresh(first.refresh_token())), OAuthError.INVALID_GRANT);
        }

        @Test
        @DisplayName("exchange should reject a refresh token issued to another client")
        void exchange_shouldThrowInvalidGrant_whenRefreshTokenBelongsToOtherClient() {
            storeCode("code-1");
            TokenResponse issued = redeem("code-1", REDIRECT_URI, VERIFIER);
            ClientRegistry.Registration other =
                harness.clientRegistry.registerClient(List.of(REDIRECT_URI), "other");

            Throwable thrown = catchThrowable(() -> service.exchange(other.client().clientId, other.clientSecret(),
                "refresh_token", null, null, null, issued.refresh_token()));

            assertError(thrown, OAuthError.INVALID_GRANT);
            assertThat(refresh(issued.refresh_token()).access_token()).isNotBlank();
        }

        @Test
        @DisplayName("exchange should reject an expired refresh token")
        void exchange_shouldThrowInvalidGrant_whenRefreshTokenExpired() {
            RefreshToken expired = new RefreshToken();
            expired.tokenHash = CryptoUtils.sha256Base64Url("stale-token");
            expired.tenantId = TENANT_ID;
            expired.clientId = clientId;
            expired.createdAt = Instant.now().minus(Duration.ofDays(31));
            expired.expiresAt = Instant.now().minusSeconds(1);
            harness.refreshTokenRepo.persist(expired);

            assertError(catchThrowable(() -> refresh("stale-token")), OAuthError.INVALID_GRANT);
        }

        @Test
        @DisplayName("exchange should reject an unknown refresh token")
        void exchange_shouldThrowInvalidGrant_whenRefreshTokenUnknown() {
            assertError(catchThrowable(() -> refresh("never-issued")), OAuthError.INVALID_GRANT);
        }

        @Test
        @DisplayName("exchange should require refresh_token")
        void exchange_shouldThrowInvalidRequest_whenRefreshTokenMissing() {
            assertError(catchThrowable(() -> refresh(null)), OAuthError.INVALID_REQUEST);
        }
    }
}
