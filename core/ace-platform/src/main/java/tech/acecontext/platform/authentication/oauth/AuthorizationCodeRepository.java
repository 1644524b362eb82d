package tech.acecontext.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AuthorizationCode records.
 */
public interface AuthorizationCodeRepository {

    // Read operations
    Optional<AuthorizationCode> findByCode(String code);

    // Write operations
    void persist(AuthorizationCode code);

    /**
     * Delete the code if it still exists.
     *
     * @return true only for the caller whose delete removed the row
     */
    boolean consume(String code);

    long deleteExpired(Instant now);
}
