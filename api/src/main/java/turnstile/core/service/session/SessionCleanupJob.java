package turnstile.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.SessionConfig;
import turnstile.core.port.in.SessionManagement;

/**
 * Periodically sweeps the global active-session index for entries whose session
 * hash has expired.
 */
@ApplicationScoped
public class SessionCleanupJob {

    private static final Logger LOG = Logger.getLogger(SessionCleanupJob.class);

    private final SessionManagement sessionManagement;
    private final SessionConfig config;

    public SessionCleanupJob(SessionManagement sessionManagement, SessionConfig config) {
        this.sessionManagement = sessionManagement;
        this.config = config;
    }

    @Scheduled(
            every = "${turnstile.session.cleanup.interval:5m}",
            delayed = "${turnstile.session.cleanup.interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> sweep() {
        if (!config.cleanup().enabled()) {
            return Uni.createFrom().voidItem();
        }

        LOG.debug("Sweeping active-session index...");

        return sessionManagement
                .cleanupExpiredSessions()
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Active-session sweep failed", e));
    }
}
