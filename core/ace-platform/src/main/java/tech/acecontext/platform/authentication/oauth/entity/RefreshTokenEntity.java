package tech.acecontext.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for refresh_tokens table.
 */
@Entity
@Table(name = "refresh_tokens")
public class RefreshTokenEntity {

    @Id
    @Column(name = "token_hash", length = 64)
    public String tokenHash;

    @Column(name = "tenant_id", nullable = false)
    public String tenantId;

    @Column(name = "client_id", nullable = false, length = 100)
    public String clientId;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    public RefreshTokenEntity() {
    }
}
