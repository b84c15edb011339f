package com.libragraph.docmirror.core.upload;

/**
 * A document that cannot be uploaded as it stands. Recorded on the row, never propagated
 * out of a batch.
 */
public class UploadException extends RuntimeException {

    public UploadException(String message) {
        super(message);
    }
}
