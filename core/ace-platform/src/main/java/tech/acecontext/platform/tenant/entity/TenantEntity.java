package tech.acecontext.platform.tenant.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for tenants table.
 */
@Entity
@Table(name = "tenants")
public class TenantEntity {

    @Id
    @Column(name = "id")
    public String id;

    @Column(name = "email", length = 320)
    public String email;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public TenantEntity() {
    }
}
