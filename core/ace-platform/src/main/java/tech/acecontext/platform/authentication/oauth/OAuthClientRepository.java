package tech.acecontext.platform.authentication.oauth;

import java.util.Optional;

/**
 * Repository interface for dynamically registered OAuth clients.
 */
public interface OAuthClientRepository {

    // Read operations
    Optional<OAuthClient> findByClientId(String clientId);

    // Write operations
    void persist(OAuthClient client);
}
