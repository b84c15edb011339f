package com.libragraph.docmirror.core.upload;

/**
 * Thrown when a retry targets a document whose upload is already claimed.
 */
public class DocumentInFlightException extends RuntimeException {

    private final long documentId;

    public DocumentInFlightException(long documentId) {
        super("Document " + documentId + " is already being uploaded");
        this.documentId = documentId;
    }

    public long documentId() {
        return documentId;
    }
}
