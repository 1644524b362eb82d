package tech.acecontext.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.acecontext.platform.authentication.oauth.OAuthClient;
import tech.acecontext.platform.authentication.oauth.OAuthClientRepository;
import tech.acecontext.platform.authentication.oauth.entity.OAuthClientEntity;
import tech.acecontext.platform.authentication.oauth.mapper.OAuthClientMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of OAuthClientRepository.
 */
@ApplicationScoped
public class PanacheOAuthClientRepository
    implements OAuthClientRepository, PanacheRepositoryBase<OAuthClientEntity, String> {

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        return find("clientId", clientId)
            .firstResultOptional()
            .map(OAuthClientMapper::toDomain);
    }

    @Override
    public void persist(OAuthClient client) {
        if (client.createdAt == null) {
            client.createdAt = Instant.now();
        }
        OAuthClientEntity entity = OAuthClientMapper.toEntity(client);
        persist(entity);
    }
}
