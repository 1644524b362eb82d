package tech.acecontext.platform.authentication.oauth;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.acecontext.platform.authentication.token.AccessTokenService;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for the authorization server HTTP surface.
 */
@Tag("integration")
@QuarkusTest
class OAuthEndpointsIntegrationTest {

    private static final String REDIRECT_URI = "https://app.example/cb";
    private static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

    @Inject
    AccessTokenService accessTokenService;

    private Response register() {
        return given()
            .contentType(ContentType.JSON)
            .body("{\"redirect_uris\":[\"" + REDIRECT_URI + "\"],\"client_name\":\"it-client\"}")
            .when()
            .post("/oauth/register");
    }

    // ==================== Registration ====================

    @Test
    @DisplayName("POST /oauth/register should return credentials once")
    void register_shouldReturnClientCredentials() {
        register()
            .then()
            .statusCode(200)
            .header("Cache-Control", "no-store")
            .body("client_id", startsWith("oac_"))
            .body("client_secret", not(emptyOrNullString()))
            .body("redirect_uris", contains(REDIRECT_URI))
            .body("token_endpoint_auth_method", equalTo("client_secret_post"))
            .body("grant_types", contains("authorization_code", "refresh_token"))
            .body("client_secret_expires_at", equalTo(0));
    }

    @Test
    @DisplayName("POST /oauth/register should reject a relative redirect URI")
    void register_shouldReturn400_whenRedirectUriRelative() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"redirect_uris\":[\"/cb\"]}")
            .when()
            .post("/oauth/register")
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_request"));
    }

    // ==================== Authorize ====================

    @Test
    @DisplayName("GET /oauth/authorize should redirect a valid request to the identity provider")
    void authorize_shouldRedirectToProvider() {
        String clientId = register().path("client_id");

        given()
            .redirects().follow(false)
            .queryParam("response_type", "code")
            .queryParam("client_id", clientId)
            .queryParam("redirect_uri", REDIRECT_URI)
            .queryParam("state", "xyz")
            .queryParam("code_challenge", CHALLENGE)
            .queryParam("code_challenge_method", "S256")
            .when()
            .get("/oauth/authorize")
            .then()
            .statusCode(302)
            .header("Location", startsWith("https://accounts.google.com/o/oauth2/v2/auth?"))
            .header("Location", containsString("client_id=test-google-client"));
    }

    @Test
    @DisplayName("GET /oauth/authorize should answer an unregistered redirect URI directly")
    void authorize_shouldReturn400_whenRedirectUriUnregistered() {
        String clientId = register().path("client_id");

        given()
            .redirects().follow(false)
            .queryParam("response_type", "code")
            .queryParam("client_id", clientId)
            .queryParam("redirect_uri", "https://evil.example/cb")
            .queryParam("code_challenge", CHALLENGE)
            .when()
            .get("/oauth/authorize")
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_request"));
    }

    @Test
    @DisplayName("GET /oauth/authorize should reject an unsupported response type")
    void authorize_shouldReturn400_whenResponseTypeToken() {
        given()
            .redirects().follow(false)
            .queryParam("response_type", "token")
            .when()
            .get("/oauth/authorize")
            .then()
            .statusCode(400)
            .body("error", equalTo("unsupported_response_type"));
    }

    // ==================== Callback ====================

    @Test
    @DisplayName("GET /oauth/callback should reject a forged state in plain text")
    void callback_shouldReturn400_whenStateInvalid() {
        given()
            .redirects().follow(false)
            .queryParam("code", "provider-code")
            .queryParam("state", "forged.state.token")
            .when()
            .get("/oauth/callback")
            .then()
            .statusCode(400)
            .contentType(containsString("text/plain"))
            .body(startsWith("invalid_state"));
    }

    // ==================== Token ====================

    @Test
    @DisplayName("POST /oauth/token should reject bad client credentials")
    void token_shouldReturn401_whenClientSecretWrong() {
        String clientId = register().path("client_id");

        given()
            .contentType(ContentType.URLENC)
            .formParam("grant_type", "authorization_code")
            .formParam("code", "anything")
            .formParam("redirect_uri", REDIRECT_URI)
            .formParam("code_verifier", "anything")
            .formParam("client_id", clientId)
            .formParam("client_secret", "wrong")
            .when()
            .post("/oauth/token")
            .then()
            .statusCode(401)
            .header("Cache-Control", "no-store")
            .body("error", equalTo("invalid_client"));
    }

    @Test
    @DisplayName("POST /oauth/token should accept client_secret_basic credentials")
    void token_shouldAuthenticateBasic_thenRejectUnknownCode() {
        Response registration = register();
        String clientId = registration.path("client_id");
        String clientSecret = registration.path("client_secret");

        given()
            .auth().preemptive().basic(clientId, clientSecret)
            .contentType(ContentType.URLENC)
            .formParam("grant_type", "authorization_code")
            .formParam("code", "never-issued")
            .formParam("redirect_uri", REDIRECT_URI)
            .formParam("code_verifier", "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk")
            .when()
            .post("/oauth/token")
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    // ==================== Discovery ====================

    @Test
    @DisplayName("GET /.well-known/oauth-authorization-server should advertise the endpoints")
    void wellKnown_shouldDescribeAuthorizationServer() {
        given()
            .when()
            .get("/.well-known/oauth-authorization-server")
            .then()
            .statusCode(200)
            .body("authorization_endpoint", endsWith("/oauth/authorize"))
            .body("token_endpoint", endsWith("/oauth/token"))
            .body("registration_endpoint", endsWith("/oauth/register"))
            .body("code_challenge_methods_supported", hasItem("S256"));
    }

    @Test
    @DisplayName("GET /.well-known/oauth-protected-resource/mcp should serve the same metadata")
    void wellKnown_shouldServeProtectedResourceUnderSuffix() {
        given()
            .when()
            .get("/.well-known/oauth-protected-resource/mcp")
            .then()
            .statusCode(200)
            .body("bearer_methods_supported", contains("header"));
    }

    // ==================== Protected resource ====================

    @Test
    @DisplayName("GET /api/tenant should challenge a request without a token")
    void tenant_shouldReturn401_whenTokenMissing() {
        given()
            .when()
            .get("/api/tenant")
            .then()
            .statusCode(401)
            .header("WWW-Authenticate", containsString("resource_metadata="))
            .body("error", equalTo("invalid_token"));
    }

    @Test
    @DisplayName("GET /api/tenant should return the tenant of a valid token")
    void tenant_shouldReturnPrincipal_whenTokenValid() {
        String token = accessTokenService.issue("google-sub-it", "it@example.com");

        given()
            .header("Authorization", "Bearer " + token)
            .when()
            .get("/api/tenant")
            .then()
            .statusCode(200)
            .body("tenant_id", equalTo("google-sub-it"))
            .body("anonymous", equalTo(false));
    }

    // ==================== Health ====================

    @Test
    @DisplayName("GET /health should report ok")
    void health_shouldReturnOk() {
        given()
            .when()
            .get("/health")
            .then()
            .statusCode(200)
            .body("status", equalTo("ok"));
    }
}
