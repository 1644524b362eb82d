package tech.acecontext.platform.tenant;

import java.util.Optional;

/**
 * Repository interface for Tenant records.
 */
public interface TenantRepository {

    // Read operations
    Optional<Tenant> findByTenantId(String tenantId);

    // Write operations

    /**
     * @throws jakarta.persistence.PersistenceException caused by a constraint
     *         violation when a tenant with the same id already exists
     */
    void persist(Tenant tenant);
}
