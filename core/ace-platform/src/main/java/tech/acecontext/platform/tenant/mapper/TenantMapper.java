package tech.acecontext.platform.tenant.mapper;

import tech.acecontext.platform.tenant.Tenant;
import tech.acecontext.platform.tenant.entity.TenantEntity;

/**
 * Mapper for converting between Tenant domain model and JPA entity.
 */
public final class TenantMapper {

    private TenantMapper() {
    }

    public static Tenant toDomain(TenantEntity entity) {
        if (entity == null) {
            return null;
        }

        Tenant domain = new Tenant();
        domain.id = entity.id;
        domain.email = entity.email;
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static TenantEntity toEntity(Tenant domain) {
        if (domain == null) {
            return null;
        }

        TenantEntity entity = new TenantEntity();
        entity.id = domain.id;
        entity.email = domain.email;
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
