package com.libragraph.docmirror.core.document;

public class DocumentNotFoundException extends RuntimeException {

    private final long documentId;

    public DocumentNotFoundException(long documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }

    public long documentId() {
        return documentId;
    }
}
