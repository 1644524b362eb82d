package tech.acecontext.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for authorization_codes table.
 */
@Entity
@Table(name = "authorization_codes")
public class AuthorizationCodeEntity {

    @Id
    @Column(name = "code", length = 64)
    public String code;

    @Column(name = "client_id", nullable = false, length = 100)
    public String clientId;

    @Column(name = "redirect_uri", nullable = false, length = 2000)
    public String redirectUri;

    @Column(name = "tenant_id", nullable = false)
    public String tenantId;

    @Column(name = "code_challenge", nullable = false, length = 128)
    public String codeChallenge;

    @Column(name = "code_challenge_method", nullable = false, length = 10)
    public String codeChallengeMethod;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    public AuthorizationCodeEntity() {
    }
}
