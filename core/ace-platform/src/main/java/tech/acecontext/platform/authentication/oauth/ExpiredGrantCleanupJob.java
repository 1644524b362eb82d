package tech.acecontext.platform.authentication.oauth;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Purges expired authorization codes and refresh tokens.
 *
 * Housekeeping only: expired rows are already rejected on lookup.
 */
@ApplicationScoped
public class ExpiredGrantCleanupJob {

    private static final Logger LOG = Logger.getLogger(ExpiredGrantCleanupJob.class);

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    RefreshTokenRepository refreshTokenRepo;

    @Scheduled(every = "${ace.auth.cleanup-interval:1h}", delayed = "1m",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    @Transactional
    void purgeExpired() {
        Instant now = Instant.now();
        long codes = codeRepo.deleteExpired(now);
        long tokens = refreshTokenRepo.deleteExpired(now);
        if (codes > 0 || tokens > 0) {
            LOG.infof("Purged %d expired authorization code(s) and %d expired refresh token(s)", codes, tokens);
        } else {
            LOG.debug("No expired grants to purge");
        }
    }
}
