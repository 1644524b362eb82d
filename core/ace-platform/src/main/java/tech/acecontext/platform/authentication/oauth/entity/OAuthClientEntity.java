package tech.acecontext.platform.authentication.oauth.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for dynamically registered OAuth clients.
 */
@Entity
@Table(name = "oauth_clients")
public class OAuthClientEntity {

    @Id
    @Column(name = "client_id", length = 17)
    public String clientId;

    @Column(name = "client_name", length = 200)
    public String clientName;

    @Column(name = "secret_hash", nullable = false, length = 64)
    public String secretHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_redirect_uris", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "redirect_uri", length = 2000)
    public List<String> redirectUris = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public OAuthClientEntity() {
    }
}
