package com.libragraph.docmirror.core.test;

import com.libragraph.docmirror.core.remote.CustomMetadata;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.remote.RemoteDocument;
import com.libragraph.docmirror.core.remote.RemoteException;
import com.libragraph.docmirror.core.remote.RemoteNotFoundException;
import com.libragraph.docmirror.core.remote.RemoteOperation;
import com.libragraph.docmirror.core.remote.RemoteStore;
import com.libragraph.docmirror.core.remote.UploadRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * In-memory stand-in for the remote File Search service. Uploads complete after a configurable
 * number of status polls; failures can be injected per upload.
 */
public class InMemoryRemoteClient implements RemoteClient {

    private final Map<String, RemoteStore> stores = new LinkedHashMap<>();
    private final Map<String, Map<String, RemoteDocument>> documents = new LinkedHashMap<>();
    private final Map<String, PendingOperation> operations = new LinkedHashMap<>();
    private final List<UploadRequest> uploads = new ArrayList<>();
    private final List<String> deletedDocuments = new ArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();

    private int pollsUntilDone;
    private Predicate<UploadRequest> failWhen = r -> false;
    private String failureMessage = "upload rejected";
    private RuntimeException uploadError;
    private RuntimeException deleteError;

    private static final class PendingOperation {
        final String storeName;
        final UploadRequest request;
        int remainingPolls;
        RemoteOperation result;

        PendingOperation(String storeName, UploadRequest request, int remainingPolls) {
            this.storeName = storeName;
            this.request = request;
            this.remainingPolls = remainingPolls;
        }
    }

    // --- test controls ---

    /** Status polls an upload reports as running before it completes; negative never completes. */
    public synchronized InMemoryRemoteClient pollsUntilDone(int polls) {
        this.pollsUntilDone = polls;
        return this;
    }

    public synchronized InMemoryRemoteClient failUploadsWhen(Predicate<UploadRequest> predicate, String message) {
        this.failWhen = predicate;
        this.failureMessage = message;
        return this;
    }

    public synchronized InMemoryRemoteClient throwOnUpload(RuntimeException error) {
        this.uploadError = error;
        return this;
    }

    public synchronized InMemoryRemoteClient throwOnDelete(RuntimeException error) {
        this.deleteError = error;
        return this;
    }

    public synchronized InMemoryRemoteClient reset() {
        pollsUntilDone = 0;
        failWhen = r -> false;
        uploadError = null;
        deleteError = null;
        return this;
    }

    /** Places a document directly into a store, bypassing upload. */
    public synchronized RemoteDocument put(String storeName, String displayName, List<CustomMetadata> metadata) {
        String name = storeName + "/documents/doc-" + sequence.incrementAndGet();
        RemoteDocument doc = new RemoteDocument(name, displayName, metadata, 0L, null,
                "2025-01-01T00:00:00Z", "2025-01-01T00:00:00Z", "STATE_ACTIVE");
        store(storeName).put(name, doc);
        return doc;
    }

    public synchronized void put(String storeName, RemoteDocument doc) {
        store(storeName).put(doc.name(), doc);
    }

    public synchronized void removeDocument(String documentName) {
        documents.values().forEach(m -> m.remove(documentName));
    }

    public synchronized List<UploadRequest> uploads() {
        return List.copyOf(uploads);
    }

    public synchronized List<String> deletedDocuments() {
        return List.copyOf(deletedDocuments);
    }

    public synchronized boolean hasStore(String storeName) {
        return stores.containsKey(storeName);
    }

    // --- RemoteClient ---

    @Override
    public synchronized RemoteStore createStore(String displayName) {
        String name = "fileSearchStores/store-" + sequence.incrementAndGet();
        RemoteStore store = new RemoteStore(name, displayName, "2025-01-01T00:00:00Z", "2025-01-01T00:00:00Z",
                0L, 0L, 0L, 0L);
        stores.put(name, store);
        documents.put(name, new LinkedHashMap<>());
        return store;
    }

    @Override
    public synchronized RemoteStore getStore(String storeName) {
        RemoteStore store = stores.get(storeName);
        if (store == null) throw new RemoteNotFoundException("No store " + storeName);
        return store;
    }

    @Override
    public synchronized void deleteStore(String storeName, boolean force) {
        if (stores.remove(storeName) == null) throw new RemoteNotFoundException("No store " + storeName);
        Map<String, RemoteDocument> docs = documents.remove(storeName);
        if (!force && docs != null && !docs.isEmpty()) {
            throw new RemoteException(400, "Store not empty");
        }
    }

    @Override
    public synchronized List<RemoteDocument> listDocuments(String storeName) {
        return new ArrayList<>(store(storeName).values());
    }

    @Override
    public synchronized RemoteDocument getDocument(String documentName) {
        for (Map<String, RemoteDocument> docs : documents.values()) {
            RemoteDocument doc = docs.get(documentName);
            if (doc != null) return doc;
        }
        throw new RemoteNotFoundException("No document " + documentName);
    }

    @Override
    public synchronized RemoteOperation upload(String storeName, UploadRequest request) {
        if (uploadError != null) throw uploadError;
        store(storeName);
        uploads.add(request);
        String name = storeName + "/upload/operations/op-" + sequence.incrementAndGet();
        PendingOperation op = new PendingOperation(storeName, request, pollsUntilDone);
        operations.put(name, op);
        if (pollsUntilDone == 0) {
            complete(name, op);
            return op.result;
        }
        return new RemoteOperation(name, false, null, null);
    }

    @Override
    public synchronized RemoteOperation getOperation(String operationName) {
        PendingOperation op = operations.get(operationName);
        if (op == null) throw new RemoteNotFoundException("No operation " + operationName);
        if (op.result != null) return op.result;
        if (op.remainingPolls < 0) return new RemoteOperation(operationName, false, null, null);
        if (--op.remainingPolls > 0) return new RemoteOperation(operationName, false, null, null);
        complete(operationName, op);
        return op.result;
    }

    @Override
    public synchronized void deleteDocument(String documentName) {
        if (deleteError != null) throw deleteError;
        deletedDocuments.add(documentName);
        removeDocument(documentName);
    }

    private void complete(String operationName, PendingOperation op) {
        if (failWhen.test(op.request)) {
            op.result = new RemoteOperation(operationName, true, null, failureMessage);
            return;
        }
        long size;
        try {
            size = Files.size(op.request.file());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        String docName = op.storeName + "/documents/doc-" + sequence.incrementAndGet();
        RemoteDocument doc = new RemoteDocument(docName, op.request.displayName(), op.request.customMetadata(),
                size, op.request.mimeType() != null ? op.request.mimeType() : "application/octet-stream",
                "2025-01-01T00:00:00Z", "2025-01-01T00:00:00Z", "STATE_ACTIVE");
        store(op.storeName).put(docName, doc);
        op.result = new RemoteOperation(operationName, true, docName, null);
    }

    private Map<String, RemoteDocument> store(String storeName) {
        Map<String, RemoteDocument> docs = documents.get(storeName);
        if (docs == null) throw new RemoteNotFoundException("No store " + storeName);
        return docs;
    }
}
