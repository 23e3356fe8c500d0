package io.nebula.identity.account;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Deletes expired account tokens.
 */
@ApplicationScoped
public class AccountTokenPurgeJob {

    private static final Logger LOG = Logger.getLogger(AccountTokenPurgeJob.class);

    @Inject
    AccountTokenRepository tokenRepository;

    @Scheduled(every = "1h", delayed = "2m", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    @Transactional
    void purgeExpired() {
        long deleted = tokenRepository.deleteExpired(Instant.now());
        if (deleted > 0) {
            LOG.infof("Purged %d expired account tokens", deleted);
        }
    }
}
