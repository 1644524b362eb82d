package tech.acecontext.platform.tenant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;
import tech.acecontext.platform.authentication.federated.FederatedIdentity;

import java.time.Instant;
import java.util.Optional;

/**
 * Provisions tenants from federated identities.
 */
@ApplicationScoped
public class TenantService {

    private static final Logger LOG = Logger.getLogger(TenantService.class);

    @Inject
    TenantRepository tenantRepo;

    /**
     * Insert the tenant for this identity if it does not exist yet.
     * A returning user gets their existing tenant back unchanged.
     *
     * The insert runs in its own transaction. When a concurrent first login
     * for the same subject wins the race, the primary key rejects ours and
     * the stored tenant is returned instead.
     */
    @Transactional
    public Tenant provision(FederatedIdentity identity) {
        Optional<Tenant> existing = tenantRepo.findByTenantId(identity.subject());
        if (existing.isPresent()) {
            LOG.debugf("Returning tenant %s signed in", identity.subject());
            return existing.get();
        }

        Tenant tenant = new Tenant();
        tenant.id = identity.subject();
        tenant.email = identity.email();
        tenant.createdAt = Instant.now();
        try {
            tenantRepo.persist(tenant);
        } catch (PersistenceException e) {
            if (!isDuplicateKey(e)) {
                throw e;
            }
            LOG.debugf("Tenant %s was provisioned concurrently, using the stored tenant", tenant.id);
            return tenantRepo.findByTenantId(identity.subject())
                .orElseThrow(() -> new IllegalStateException(
                    "Duplicate key for tenant " + identity.subject() + " but tenant not found", e));
        }

        LOG.infof("Provisioned tenant %s", tenant.id);
        return tenant;
    }

    private static boolean isDuplicateKey(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                return true;
            }
        }
        return false;
    }

    public Optional<Tenant> find(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Optional.empty();
        }
        return tenantRepo.findByTenantId(tenantId);
    }
}
