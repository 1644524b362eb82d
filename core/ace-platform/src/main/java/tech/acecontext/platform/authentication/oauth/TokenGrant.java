package tech.acecontext.platform.authentication.oauth;

import tech.acecontext.platform.authentication.OAuthError;
import tech.acecontext.platform.authentication.OAuthException;

/**
 * A token request grant, parsed from the token endpoint form.
 */
public sealed interface TokenGrant permits TokenGrant.AuthorizationCodeGrant, TokenGrant.RefreshTokenGrant {

    String AUTHORIZATION_CODE = "authorization_code";
    String REFRESH_TOKEN = "refresh_token";

    /**
     * grant_type=authorization_code
     */
    record AuthorizationCodeGrant(String code, String redirectUri, String codeVerifier) implements TokenGrant {
    }

    /**
     * grant_type=refresh_token
     */
    record RefreshTokenGrant(String refreshToken) implements TokenGrant {
    }

    /**
     * Parse the grant from form parameters.
     *
     * @throws OAuthException invalid_request when grant_type or a grant parameter is missing,
     *                        unsupported_grant_type for any other grant type
     */
    static TokenGrant parse(String grantType, String code, String redirectUri, String codeVerifier,
                            String refreshToken) {
        if (grantType == null || grantType.isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "grant_type is required");
        }
        return switch (grantType) {
            case AUTHORIZATION_CODE -> {
                requireParam(code, "code");
                requireParam(redirectUri, "redirect_uri");
                requireParam(codeVerifier, "code_verifier");
                yield new AuthorizationCodeGrant(code, redirectUri, codeVerifier);
            }
            case REFRESH_TOKEN -> {
                requireParam(refreshToken, "refresh_token");
                yield new RefreshTokenGrant(refreshToken);
            }
            default -> throw new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE,
                "Grant type '" + grantType + "' is not supported");
        };
    }

    private static void requireParam(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, name + " is required");
        }
    }
}
