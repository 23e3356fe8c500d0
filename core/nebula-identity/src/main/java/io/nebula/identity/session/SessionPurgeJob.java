package io.nebula.identity.session;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Deletes expired sessions, including anonymous ones left by abandoned federated logins.
 */
@ApplicationScoped
public class SessionPurgeJob {

    private static final Logger LOG = Logger.getLogger(SessionPurgeJob.class);

    @Inject
    WebSessionRepository sessionRepository;

    @Scheduled(every = "1h", delayed = "1m", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    @Transactional
    void purgeExpired() {
        long deleted = sessionRepository.deleteExpired(Instant.now());
        if (deleted > 0) {
            LOG.infof("Purged %d expired sessions", deleted);
        }
    }
}
