package tech.acecontext.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.acecontext.platform.authentication.oauth.AuthorizationCode;
import tech.acecontext.platform.authentication.oauth.AuthorizationCodeRepository;
import tech.acecontext.platform.authentication.oauth.entity.AuthorizationCodeEntity;
import tech.acecontext.platform.authentication.oauth.mapper.AuthorizationCodeMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AuthorizationCodeRepository.
 *
 * {@link #consume(String)} is a single conditional DELETE, so the database
 * decides which of two concurrent redemptions wins.
 */
@ApplicationScoped
public class PanacheAuthorizationCodeRepository
    implements AuthorizationCodeRepository, PanacheRepositoryBase<AuthorizationCodeEntity, String> {

    @Override
    public Optional<AuthorizationCode> findByCode(String code) {
        return find("code", code)
            .firstResultOptional()
            .map(AuthorizationCodeMapper::toDomain);
    }

    @Override
    @Transactional
    public void persist(AuthorizationCode authCode) {
        if (authCode.createdAt == null) {
            authCode.createdAt = Instant.now();
        }
        AuthorizationCodeEntity entity = AuthorizationCodeMapper.toEntity(authCode);
        persist(entity);
    }

    @Override
    public boolean consume(String code) {
        return delete("code", code) > 0;
    }

    @Override
    public long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
