package tech.acecontext.platform.authentication.oauth.mapper;

import tech.acecontext.platform.authentication.oauth.RefreshToken;
import tech.acecontext.platform.authentication.oauth.entity.RefreshTokenEntity;

/**
 * Mapper for converting between RefreshToken domain model and JPA entity.
 */
public final class RefreshTokenMapper {

    private RefreshTokenMapper() {
    }

    public static RefreshToken toDomain(RefreshTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        RefreshToken domain = new RefreshToken();
        domain.tokenHash = entity.tokenHash;
        domain.tenantId = entity.tenantId;
        domain.clientId = entity.clientId;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        return domain;
    }

    public static RefreshTokenEntity toEntity(RefreshToken domain) {
        if (domain == null) {
            return null;
        }

        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.tokenHash = domain.tokenHash;
        entity.tenantId = domain.tenantId;
        entity.clientId = domain.clientId;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        return entity;
    }
}
