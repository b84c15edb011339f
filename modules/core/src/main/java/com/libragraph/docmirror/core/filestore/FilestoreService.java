package com.libragraph.docmirror.core.filestore;

import com.libragraph.docmirror.core.dao.DocumentDao;
import com.libragraph.docmirror.core.dao.DocumentRepository;
import com.libragraph.docmirror.core.dao.FilestoreDao;
import com.libragraph.docmirror.core.dao.FilestoreQuery;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.remote.RemoteDocument;
import com.libragraph.docmirror.core.remote.RemoteNotFoundException;
import com.libragraph.docmirror.core.remote.RemoteStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Lifecycle of filestores and their remote stores. Lookups are scoped to an owner; another
 * owner's filestore is reported as not found.
 */
@ApplicationScoped
public class FilestoreService {

    private static final Logger log = Logger.getLogger(FilestoreService.class);

    private Jdbi jdbi;
    private RemoteClient remote;
    private DocumentRepository repository;

    @Inject
    public FilestoreService(Jdbi jdbi, RemoteClient remote, DocumentRepository repository) {
        this.jdbi = jdbi;
        this.remote = remote;
        this.repository = repository;
    }

    /** Creates the remote store first, then the local row bound to it. */
    public FilestoreRecord create(String owner, String displayName) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName is required");
        }
        RemoteStore store = remote.createStore(displayName.trim());
        NewFilestore row = new NewFilestore(owner, store.name(),
                store.displayName() != null ? store.displayName() : displayName.trim(),
                store.createTime(), store.updateTime(), Instant.now());
        long id = jdbi.withExtension(FilestoreDao.class, dao -> dao.insert(row));
        log.infof("Created filestore %d bound to %s", id, store.name());
        return get(owner, id);
    }

    public FilestoreRecord get(String owner, long id) {
        return jdbi.withExtension(FilestoreDao.class, dao -> dao.findById(id))
                .filter(f -> Objects.equals(f.owner(), owner))
                .orElseThrow(() -> new FilestoreNotFoundException(id));
    }

    public List<FilestoreRecord> query(String owner, FilestoreQuery query) {
        return repository.queryFilestores(owner, query);
    }

    /**
     * Deletes the remote store with all its documents, then the filestore and its document rows.
     */
    public void delete(String owner, long id) {
        FilestoreRecord filestore = get(owner, id);
        if (filestore.name() != null) {
            try {
                remote.deleteStore(filestore.name(), true);
            } catch (RemoteNotFoundException e) {
                log.debugf("Remote store %s already gone", filestore.name());
            }
        }
        int documents = jdbi.inTransaction(handle -> {
            int removed = handle.attach(DocumentDao.class).deleteByFilestore(id);
            handle.attach(FilestoreDao.class).deleteById(id);
            return removed;
        });
        log.infof("Deleted filestore %d with %d documents", id, documents);
    }

    public List<CategoryCount> categories(String owner, long id) {
        get(owner, id);
        return jdbi.withExtension(DocumentDao.class, dao -> dao.categories(id));
    }

    /** Live remote listing, bypassing local state. */
    public List<RemoteDocument> remoteDocuments(String owner, long id) {
        FilestoreRecord filestore = get(owner, id);
        if (filestore.name() == null) {
            return List.of();
        }
        return remote.listDocuments(filestore.name());
    }
}
