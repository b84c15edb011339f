package com.libragraph.docmirror.core.ingest;

import com.libragraph.docmirror.core.dao.DocumentDao;
import com.libragraph.docmirror.core.dao.FilestoreDao;
import com.libragraph.docmirror.core.document.DocumentRecord;
import com.libragraph.docmirror.core.document.DocumentState;
import com.libragraph.docmirror.core.document.NewDocument;
import com.libragraph.docmirror.core.filestore.FilestoreNotFoundException;
import com.libragraph.docmirror.core.filestore.FilestoreRecord;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.remote.RemoteException;
import com.libragraph.docmirror.core.storage.ContentStore;
import com.libragraph.docmirror.core.storage.StoredContent;
import com.libragraph.docmirror.core.upload.UploadWorker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.io.InputStream;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Accepts uploaded files into a filestore. The bytes go into the content cache and a pending
 * document row is queued for the upload worker. Re-ingesting identical bytes into the same
 * filestore supersedes the earlier document, including its remote copy.
 */
@ApplicationScoped
public class IngestionService {

    private static final Logger log = Logger.getLogger(IngestionService.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private Jdbi jdbi;
    private ContentStore contentStore;
    private RemoteClient remote;
    private UploadWorker worker;

    @Inject
    public IngestionService(Jdbi jdbi, ContentStore contentStore, RemoteClient remote, UploadWorker worker) {
        this.jdbi = jdbi;
        this.contentStore = contentStore;
        this.remote = remote;
        this.worker = worker;
    }

    public DocumentRecord ingest(long filestoreId, String category, String filename, InputStream content) {
        FilestoreRecord filestore = requireFilestore(filestoreId);
        DocumentRecord doc = store(filestore, category, filename, content);
        worker.trigger();
        return doc;
    }

    public List<DocumentRecord> ingestAll(long filestoreId, String category, List<Upload> uploads) {
        FilestoreRecord filestore = requireFilestore(filestoreId);
        List<DocumentRecord> docs = new ArrayList<>(uploads.size());
        try {
            for (Upload upload : uploads) {
                docs.add(store(filestore, category, upload.filename(), upload.content()));
            }
        } finally {
            if (!docs.isEmpty()) worker.trigger();
        }
        return docs;
    }

    private FilestoreRecord requireFilestore(long filestoreId) {
        return jdbi.withExtension(FilestoreDao.class, dao -> dao.findById(filestoreId))
                .orElseThrow(() -> new FilestoreNotFoundException(filestoreId));
    }

    private DocumentRecord store(FilestoreRecord filestore, String category, String filename, InputStream content) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }
        StoredContent stored = contentStore.put(filename, content);
        String hash = stored.hash().toHex();

        List<DocumentRecord> previous = jdbi.withExtension(DocumentDao.class,
                dao -> dao.findByFilestoreAndHash(filestore.id(), hash));
        for (DocumentRecord old : previous) {
            deleteRemoteCopy(old);
        }

        NewDocument row = new NewDocument(filestore.id(), filestore.owner(), stored.filename(), stored.url(),
                hash, stored.size(), displayName(filename), stored.mimeType(),
                category == null || category.isBlank() ? null : category.trim(),
                DocumentState.PENDING, Instant.now());
        long id = insertReplacing(row);
        log.infof("Ingested %s into filestore %d as document %d (%s, %d bytes%s)",
                row.displayName(), filestore.id(), id, stored.relativePath(), stored.size(),
                previous.isEmpty() ? "" : ", superseding " + previous.size());
        return jdbi.withExtension(DocumentDao.class, dao -> dao.findById(id)).orElseThrow();
    }

    /**
     * Drops any row with the same content and inserts the new one in one transaction. A
     * concurrent ingest of the same bytes can win the unique key between our delete and insert;
     * one more round makes the later writer win.
     */
    private long insertReplacing(NewDocument row) {
        for (int attempt = 1; ; attempt++) {
            try {
                return jdbi.inTransaction(handle -> {
                    DocumentDao dao = handle.attach(DocumentDao.class);
                    dao.deleteByFilestoreAndHash(row.filestoreId(), row.hash());
                    return dao.insert(row);
                });
            } catch (UnableToExecuteStatementException e) {
                if (attempt > 1 || !isUniqueViolation(e)) throw e;
                log.debugf("Concurrent ingest of %s in filestore %d, retrying", row.hash(), row.filestoreId());
            }
        }
    }

    private void deleteRemoteCopy(DocumentRecord old) {
        if (old.name() == null) return;
        try {
            remote.deleteDocument(old.name());
        } catch (RemoteException e) {
            log.warnf("Could not delete superseded remote document %s: %s", old.name(), e.getMessage());
        }
    }

    static String displayName(String filename) {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return filename.substring(slash + 1).trim();
    }

    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException && UNIQUE_VIOLATION.equals(((SQLException) t).getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
