package com.libragraph.docmirror.core.remote;

import java.util.List;

/**
 * The remote File Search service. All calls are blocking; transport and API errors surface as
 * {@link RemoteException}.
 */
public interface RemoteClient {

    RemoteStore createStore(String displayName);

    RemoteStore getStore(String storeName);

    /** Deletes a store; {@code force} also removes its documents. */
    void deleteStore(String storeName, boolean force);

    /** All documents of a store, following pagination. */
    List<RemoteDocument> listDocuments(String storeName);

    RemoteDocument getDocument(String documentName);

    /** Starts an upload; the returned operation completes asynchronously. */
    RemoteOperation upload(String storeName, UploadRequest request);

    RemoteOperation getOperation(String operationName);

    /** Deletes a document. A document that no longer exists counts as deleted. */
    void deleteDocument(String documentName);
}
