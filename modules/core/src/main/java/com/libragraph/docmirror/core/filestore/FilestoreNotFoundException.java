package com.libragraph.docmirror.core.filestore;

public class FilestoreNotFoundException extends RuntimeException {

    private final long filestoreId;

    public FilestoreNotFoundException(long filestoreId) {
        super("Filestore not found: " + filestoreId);
        this.filestoreId = filestoreId;
    }

    public long filestoreId() {
        return filestoreId;
    }
}
