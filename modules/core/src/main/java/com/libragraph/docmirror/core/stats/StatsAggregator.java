package com.libragraph.docmirror.core.stats;

import com.libragraph.docmirror.core.dao.DocumentDao;
import com.libragraph.docmirror.core.dao.FilestoreDao;
import com.libragraph.docmirror.core.document.DocumentState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;

/**
 * Derives a filestore's counters from its documents and writes them onto the filestore row.
 * Counters are always recomputed wholesale, never adjusted incrementally.
 */
@ApplicationScoped
public class StatsAggregator {

    private static final Logger log = Logger.getLogger(StatsAggregator.class);

    private Jdbi jdbi;

    @Inject
    public StatsAggregator(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    public FilestoreStats recompute(long filestoreId) {
        FilestoreStats stats = jdbi.inTransaction(handle -> {
            FilestoreStats s = handle.attach(DocumentDao.class).stats(filestoreId,
                    DocumentState.ACTIVE, DocumentState.PENDING, DocumentState.FAILED);
            handle.attach(FilestoreDao.class).updateStats(filestoreId,
                    s.active(), s.pending(), s.failed(), s.sizeBytes(), Instant.now());
            return s;
        });
        log.debugf("Filestore %d stats: active=%d pending=%d failed=%d size=%d",
                filestoreId, stats.active(), stats.pending(), stats.failed(), stats.sizeBytes());
        return stats;
    }
}
