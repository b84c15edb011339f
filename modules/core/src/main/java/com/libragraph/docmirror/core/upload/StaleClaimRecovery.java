package com.libragraph.docmirror.core.upload;

import com.libragraph.docmirror.core.config.MirrorConfig;
import com.libragraph.docmirror.core.dao.DocumentDao;
import com.libragraph.docmirror.core.document.DocumentState;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Duration;
import java.time.Instant;

/**
 * Releases upload claims whose holder never reached a terminal state, e.g. after a crash.
 * Released documents become claimable again and the worker is woken.
 */
@ApplicationScoped
public class StaleClaimRecovery {

    private static final Logger log = Logger.getLogger(StaleClaimRecovery.class);

    private Jdbi jdbi;
    private UploadWorker worker;
    private Duration claimLease;

    @Inject
    public StaleClaimRecovery(Jdbi jdbi, UploadWorker worker, MirrorConfig config) {
        this.jdbi = jdbi;
        this.worker = worker;
        this.claimLease = config.worker().claimLease();
    }

    @Scheduled(every = "${mirror.worker.sweep-interval:60s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        int released = releaseExpiredClaims();
        if (released > 0) {
            worker.trigger();
        }
    }

    public int releaseExpiredClaims() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(claimLease);
        int released = jdbi.withExtension(DocumentDao.class,
                dao -> dao.releaseStaleClaims(DocumentState.PENDING, cutoff, now));
        if (released > 0) {
            log.warnf("Released %d upload claims older than %s", released, claimLease);
        }
        return released;
    }
}
