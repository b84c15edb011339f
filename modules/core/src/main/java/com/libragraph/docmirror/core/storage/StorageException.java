package com.libragraph.docmirror.core.storage;

/**
 * Wraps checked I/O exceptions from the local content cache.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
