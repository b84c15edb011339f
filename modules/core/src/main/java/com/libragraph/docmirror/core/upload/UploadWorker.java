package com.libragraph.docmirror.core.upload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docmirror.core.config.MirrorConfig;
import com.libragraph.docmirror.core.dao.DocumentDao;
import com.libragraph.docmirror.core.dao.FilestoreDao;
import com.libragraph.docmirror.core.document.DocumentNotFoundException;
import com.libragraph.docmirror.core.document.DocumentRecord;
import com.libragraph.docmirror.core.document.DocumentState;
import com.libragraph.docmirror.core.filestore.FilestoreRecord;
import com.libragraph.docmirror.core.mime.MimeTypeResolver;
import com.libragraph.docmirror.core.remote.CustomMetadata;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.remote.RemoteDocument;
import com.libragraph.docmirror.core.remote.RemoteException;
import com.libragraph.docmirror.core.remote.RemoteOperation;
import com.libragraph.docmirror.core.remote.UploadRequest;
import com.libragraph.docmirror.core.stats.StatsAggregator;
import com.libragraph.docmirror.core.storage.ContentStore;
import com.libragraph.docmirror.core.storage.StorageException;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the upload queue: pending documents are claimed in batches, uploaded concurrently and
 * moved to a terminal state.
 *
 * <p>At most one drain loop runs per worker; {@link #trigger()} while it runs is a no-op. The
 * claim itself is a conditional update, so separate workers (or a manual {@link #retry}) never
 * process the same document twice.
 */
@ApplicationScoped
public class UploadWorker {

    private static final Logger log = Logger.getLogger(UploadWorker.class);

    private Jdbi jdbi;
    private RemoteClient remote;
    private ContentStore contentStore;
    private MimeTypeResolver mimeTypes;
    private OperationAwaiter awaiter;
    private StatsAggregator stats;
    private ObjectMapper objectMapper;
    private Executor executor;
    private int batchSize;

    private final AtomicBoolean running = new AtomicBoolean();

    @Inject
    public UploadWorker(Jdbi jdbi,
                        RemoteClient remote,
                        ContentStore contentStore,
                        MimeTypeResolver mimeTypes,
                        OperationAwaiter awaiter,
                        StatsAggregator stats,
                        ObjectMapper objectMapper,
                        @Named("uploadWorker") Executor executor,
                        MirrorConfig config) {
        this.jdbi = jdbi;
        this.remote = remote;
        this.contentStore = contentStore;
        this.mimeTypes = mimeTypes;
        this.awaiter = awaiter;
        this.stats = stats;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.batchSize = config.worker().batchSize();
    }

    void onStart(@Observes StartupEvent event) {
        log.info("Resuming pending uploads");
        trigger();
    }

    /**
     * Starts the drain loop unless it is already running.
     */
    public void trigger() {
        if (running.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void drain() {
        boolean clean = false;
        int total = 0;
        try {
            int processed;
            while ((processed = runBatch()) > 0) {
                total += processed;
            }
            clean = true;
        } catch (RuntimeException e) {
            log.error("Upload loop stopped", e);
        } finally {
            running.set(false);
        }
        if (total > 0) {
            log.infof("Upload queue drained, %d documents processed", total);
        }
        // work queued while we were going idle found running=true and was dropped
        if (clean && hasClaimable()) {
            trigger();
        }
    }

    private boolean hasClaimable() {
        try {
            return jdbi.withExtension(DocumentDao.class, dao -> dao.countClaimable(DocumentState.PENDING)) > 0;
        } catch (RuntimeException e) {
            log.warn("Failed to re-check the upload queue", e);
            return false;
        }
    }

    /**
     * One activation: claims up to {@code batch-size} of the oldest pending documents, uploads
     * them and refreshes the counters of every filestore touched.
     *
     * @return the number of documents claimed and processed
     */
    public int runBatch() {
        List<Long> candidates = jdbi.withExtension(DocumentDao.class,
                dao -> dao.findClaimable(DocumentState.PENDING, batchSize));
        if (candidates.isEmpty()) {
            return 0;
        }

        List<DocumentRecord> claimed = new ArrayList<>();
        for (Long id : candidates) {
            claim(id).ifPresent(claimed::add);
        }
        if (claimed.isEmpty()) {
            log.debugf("All %d candidates were claimed elsewhere", candidates.size());
            return 0;
        }
        log.infof("Claimed %d documents for upload", claimed.size());

        Set<Long> touched = new LinkedHashSet<>();
        claimed.forEach(doc -> touched.add(doc.filestoreId()));
        try {
            Multi.createFrom().iterable(claimed)
                    .onItem().transformToUni(doc -> Uni.createFrom().item(() -> {
                                process(doc);
                                return doc.id();
                            })
                            .runSubscriptionOn(Infrastructure.getDefaultWorkerPool()))
                    .merge(batchSize)
                    .collect().asList()
                    .await().indefinitely();
        } finally {
            touched.forEach(stats::recompute);
        }
        return claimed.size();
    }

    private Optional<DocumentRecord> claim(long id) {
        return jdbi.inTransaction(handle -> {
            DocumentDao dao = handle.attach(DocumentDao.class);
            if (dao.claim(id, DocumentState.PENDING, Instant.now()) == 0) {
                return Optional.empty();
            }
            return dao.findById(id);
        });
    }

    /**
     * Re-uploads a document from its cached bytes, synchronously.
     *
     * @throws DocumentNotFoundException  when the document does not exist
     * @throws DocumentInFlightException when its upload is currently claimed
     */
    public DocumentRecord retry(long documentId) {
        DocumentRecord previous = find(documentId);
        int claimed = jdbi.withExtension(DocumentDao.class,
                dao -> dao.resetAndClaim(documentId, DocumentState.PENDING, Instant.now()));
        if (claimed == 0) {
            throw new DocumentInFlightException(documentId);
        }
        log.infof("Retrying upload of document %d (%s)", documentId, previous.displayName());

        if (previous.name() != null) {
            try {
                remote.deleteDocument(previous.name());
            } catch (RemoteException e) {
                log.warnf("Could not delete previous remote copy %s of document %d: %s",
                        previous.name(), documentId, e.getMessage());
            }
        }

        process(find(documentId));
        stats.recompute(previous.filestoreId());
        return find(documentId);
    }

    private DocumentRecord find(long documentId) {
        return jdbi.withExtension(DocumentDao.class, dao -> dao.findById(documentId))
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * Uploads one claimed document and records the outcome. Only database faults escape.
     */
    void process(DocumentRecord doc) {
        RemoteDocument uploaded;
        try {
            uploaded = upload(doc);
        } catch (StorageException | JdbiException e) {
            throw e;
        } catch (RuntimeException e) {
            String error = message(e);
            log.errorf("Upload of document %d (%s) failed: %s", doc.id(), doc.displayName(), error);
            int updated = jdbi.withExtension(DocumentDao.class,
                    dao -> dao.markFailed(doc.id(), DocumentState.FAILED, error, Instant.now()));
            if (updated == 0) {
                log.debugf("Document %d was removed before its failure could be recorded", doc.id());
            }
            return;
        }

        String customMetadata = json(uploaded.customMetadata());
        int updated = jdbi.withExtension(DocumentDao.class, dao -> dao.markUploaded(doc.id(), DocumentState.ACTIVE,
                uploaded.name(), uploaded.createTime(), uploaded.updateTime(), uploaded.sizeBytes(),
                uploaded.mimeType(), customMetadata, Instant.now()));
        if (updated == 0) {
            // row was replaced or deleted while the upload ran
            log.warnf("Document %d (%s) was removed during upload, deleting remote copy %s",
                    doc.id(), doc.displayName(), uploaded.name());
            discardRemote(uploaded.name());
            return;
        }
        log.infof("Uploaded document %d (%s) as %s", doc.id(), doc.displayName(), uploaded.name());
    }

    private void discardRemote(String name) {
        try {
            remote.deleteDocument(name);
        } catch (RemoteException e) {
            log.errorf("Could not delete orphaned remote document %s: %s", name, e.getMessage());
        }
    }

    private RemoteDocument upload(DocumentRecord doc) {
        FilestoreRecord filestore = jdbi.withExtension(FilestoreDao.class, dao -> dao.findById(doc.filestoreId()))
                .orElseThrow(() -> new UploadException("Filestore " + doc.filestoreId() + " not found"));
        if (filestore.name() == null) {
            throw new UploadException("Filestore " + filestore.id() + " has no remote store");
        }
        Path file = contentStore.resolve(doc.url());
        if (!Files.isRegularFile(file)) {
            throw new UploadException("File not found in cache: " + doc.url());
        }

        UploadRequest request = new UploadRequest(file, doc.displayName(),
                mimeTypes.uploadMimeType(doc.displayName()).orElse(null),
                CustomMetadata.forDocument(doc.id(), doc.hash(), doc.category()));
        RemoteOperation operation = awaiter.await(remote.upload(filestore.name(), request));
        if (operation.failed()) {
            throw new UploadException("Upload operation failed: " + operation.errorMessage());
        }
        if (operation.documentName() == null) {
            throw new UploadException("Upload operation " + operation.name() + " returned no document");
        }
        return remote.getDocument(operation.documentName());
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize custom metadata", e);
        }
    }

    private static String message(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
