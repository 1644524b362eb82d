package tech.acecontext.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.acecontext.platform.authentication.oauth.RefreshToken;
import tech.acecontext.platform.authentication.oauth.RefreshTokenRepository;
import tech.acecontext.platform.authentication.oauth.entity.RefreshTokenEntity;
import tech.acecontext.platform.authentication.oauth.mapper.RefreshTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 */
@ApplicationScoped
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    public void persist(RefreshToken token) {
        if (token.createdAt == null) {
            token.createdAt = Instant.now();
        }
        RefreshTokenEntity entity = RefreshTokenMapper.toEntity(token);
        persist(entity);
    }

    @Override
    public boolean deleteByTokenHash(String tokenHash) {
        return delete("tokenHash", tokenHash) > 0;
    }

    @Override
    public long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
