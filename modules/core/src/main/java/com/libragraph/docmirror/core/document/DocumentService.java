package com.libragraph.docmirror.core.document;

import com.libragraph.docmirror.core.dao.DocumentDao;
import com.libragraph.docmirror.core.dao.DocumentQuery;
import com.libragraph.docmirror.core.dao.DocumentRepository;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.stats.StatsAggregator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Objects;

@ApplicationScoped
public class DocumentService {

    private static final Logger log = Logger.getLogger(DocumentService.class);

    private Jdbi jdbi;
    private RemoteClient remote;
    private DocumentRepository repository;
    private StatsAggregator stats;

    @Inject
    public DocumentService(Jdbi jdbi, RemoteClient remote, DocumentRepository repository, StatsAggregator stats) {
        this.jdbi = jdbi;
        this.remote = remote;
        this.repository = repository;
        this.stats = stats;
    }

    public DocumentRecord get(String owner, long id) {
        return jdbi.withExtension(DocumentDao.class, dao -> dao.findById(id))
                .filter(d -> Objects.equals(d.owner(), owner))
                .orElseThrow(() -> new DocumentNotFoundException(id));
    }

    public List<DocumentRecord> query(String owner, DocumentQuery query) {
        return repository.query(owner, query);
    }

    /**
     * Removes the remote copy, then the local row. A remote failure other than not-found leaves
     * the local row in place.
     */
    public void delete(String owner, long id) {
        DocumentRecord doc = get(owner, id);
        if (doc.name() != null) {
            remote.deleteDocument(doc.name());
        }
        jdbi.useExtension(DocumentDao.class, dao -> dao.deleteById(id));
        stats.recompute(doc.filestoreId());
        log.infof("Deleted document %d (%s)", id, doc.displayName());
    }
}
