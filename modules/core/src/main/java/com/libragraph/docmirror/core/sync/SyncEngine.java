package com.libragraph.docmirror.core.sync;

import com.libragraph.docmirror.core.config.MirrorConfig;
import com.libragraph.docmirror.core.dao.DocumentDao;
import com.libragraph.docmirror.core.dao.FilestoreDao;
import com.libragraph.docmirror.core.document.DocumentRecord;
import com.libragraph.docmirror.core.document.SyncIssue;
import com.libragraph.docmirror.core.filestore.FilestoreNotFoundException;
import com.libragraph.docmirror.core.filestore.FilestoreRecord;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.remote.RemoteDocument;
import com.libragraph.docmirror.core.stats.StatsAggregator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares a filestore's documents with the remote store's listing, flags divergent local
 * documents and reports the differences. Local fields other than the issue marker are never
 * touched, so repeated syncs of the same state change nothing.
 */
@ApplicationScoped
public class SyncEngine {

    private static final Logger log = Logger.getLogger(SyncEngine.class);

    private Jdbi jdbi;
    private RemoteClient remote;
    private StatsAggregator stats;
    private int sampleSize;
    private NameTieBreak tieBreak;

    @Inject
    public SyncEngine(Jdbi jdbi, RemoteClient remote, StatsAggregator stats, MirrorConfig config) {
        this.jdbi = jdbi;
        this.remote = remote;
        this.stats = stats;
        this.sampleSize = config.sync().sampleSize();
        this.tieBreak = config.sync().nameTieBreak();
    }

    public SyncReport sync(long filestoreId) {
        FilestoreRecord filestore = jdbi.withExtension(FilestoreDao.class, dao -> dao.findById(filestoreId))
                .orElseThrow(() -> new FilestoreNotFoundException(filestoreId));
        if (filestore.name() == null) {
            throw new IllegalStateException("Filestore " + filestoreId + " has no remote store");
        }

        List<DocumentRecord> locals = jdbi.withExtension(DocumentDao.class, dao -> dao.findByFilestore(filestoreId));
        List<RemoteDocument> remotes = remote.listDocuments(filestore.name());

        Reconciliation reconciliation = new Reconciliation(locals, tieBreak);
        remotes.forEach(reconciliation::accept);
        SyncReport report = reconciliation.report(sampleSize);

        int changed = persist(locals, reconciliation.issues());
        stats.recompute(filestoreId);

        log.infof("Synced filestore %d: local=%d remote=%d matched=%d, %d issue markers changed",
                filestoreId, locals.size(), remotes.size(), report.summary().matchedDocuments(), changed);
        return report;
    }

    private int persist(List<DocumentRecord> locals, Map<Long, SyncIssue> issues) {
        Instant now = Instant.now();
        return jdbi.inTransaction(handle -> {
            DocumentDao dao = handle.attach(DocumentDao.class);
            int changed = 0;
            for (DocumentRecord local : locals) {
                SyncIssue next = issues.get(local.id());
                if (!Objects.equals(next, local.issue())) {
                    dao.updateIssue(local.id(), next == null ? null : next.name(), now);
                    changed++;
                }
            }
            return changed;
        });
    }
}
