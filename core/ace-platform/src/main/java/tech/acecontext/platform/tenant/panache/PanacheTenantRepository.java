package tech.acecontext.platform.tenant.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.acecontext.platform.tenant.Tenant;
import tech.acecontext.platform.tenant.TenantRepository;
import tech.acecontext.platform.tenant.entity.TenantEntity;
import tech.acecontext.platform.tenant.mapper.TenantMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of TenantRepository.
 */
@ApplicationScoped
public class PanacheTenantRepository
    implements TenantRepository, PanacheRepositoryBase<TenantEntity, String> {

    @Override
    public Optional<Tenant> findByTenantId(String tenantId) {
        return find("id", tenantId)
            .firstResultOptional()
            .map(TenantMapper::toDomain);
    }

    /**
     * Inserts in a new transaction and flushes, so a duplicate id surfaces
     * here as a constraint violation and never poisons the caller's transaction.
     */
    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void persist(Tenant tenant) {
        if (tenant.createdAt == null) {
            tenant.createdAt = Instant.now();
        }
        persistAndFlush(TenantMapper.toEntity(tenant));
    }
}
