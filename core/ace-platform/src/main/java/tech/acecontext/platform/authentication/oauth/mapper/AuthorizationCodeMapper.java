package tech.acecontext.platform.authentication.oauth.mapper;

import tech.acecontext.platform.authentication.oauth.AuthorizationCode;
import tech.acecontext.platform.authentication.oauth.entity.AuthorizationCodeEntity;

/**
 * Mapper for converting between AuthorizationCode domain model and JPA entity.
 */
public final class AuthorizationCodeMapper {

    private AuthorizationCodeMapper() {
    }

    public static AuthorizationCode toDomain(AuthorizationCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        AuthorizationCode domain = new AuthorizationCode();
        domain.code = entity.code;
        domain.clientId = entity.clientId;
        domain.redirectUri = entity.redirectUri;
        domain.tenantId = entity.tenantId;
        domain.codeChallenge = entity.codeChallenge;
        domain.codeChallengeMethod = entity.codeChallengeMethod;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        return domain;
    }

    public static AuthorizationCodeEntity toEntity(AuthorizationCode domain) {
        if (domain == null) {
            return null;
        }

        AuthorizationCodeEntity entity = new AuthorizationCodeEntity();
        entity.code = domain.code;
        entity.clientId = domain.clientId;
        entity.redirectUri = domain.redirectUri;
        entity.tenantId = domain.tenantId;
        entity.codeChallenge = domain.codeChallenge;
        entity.codeChallengeMethod = domain.codeChallengeMethod;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        return entity;
    }
}
