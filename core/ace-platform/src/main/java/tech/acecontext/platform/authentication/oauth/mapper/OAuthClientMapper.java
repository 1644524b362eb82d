package tech.acecontext.platform.authentication.oauth.mapper;

import tech.acecontext.platform.authentication.oauth.OAuthClient;
import tech.acecontext.platform.authentication.oauth.entity.OAuthClientEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between OAuthClient domain model and JPA entity.
 */
public final class OAuthClientMapper {

    private OAuthClientMapper() {
    }

    public static OAuthClient toDomain(OAuthClientEntity entity) {
        if (entity == null) {
            return null;
        }

        OAuthClient domain = new OAuthClient();
        domain.clientId = entity.clientId;
        domain.clientName = entity.clientName;
        domain.secretHash = entity.secretHash;
        domain.redirectUris = entity.redirectUris != null ? new ArrayList<>(entity.redirectUris) : new ArrayList<>();
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static OAuthClientEntity toEntity(OAuthClient domain) {
        if (domain == null) {
            return null;
        }

        OAuthClientEntity entity = new OAuthClientEntity();
        entity.clientId = domain.clientId;
        entity.clientName = domain.clientName;
        entity.secretHash = domain.secretHash;
        entity.redirectUris = domain.redirectUris != null ? new ArrayList<>(domain.redirectUris) : new ArrayList<>();
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
