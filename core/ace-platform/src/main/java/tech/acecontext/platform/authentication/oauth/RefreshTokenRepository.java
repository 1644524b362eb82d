package tech.acecontext.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for RefreshToken records.
 */
public interface RefreshTokenRepository {

    // Read operations
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    // Write operations
    void persist(RefreshToken token);

    /**
     * Delete the token if it still exists.
     *
     * @return true only for the caller whose delete removed the row
     */
    boolean deleteByTokenHash(String tokenHash);

    long deleteExpired(Instant now);
}
