package com.libragraph.docmirror.core.remote;

/**
 * A failed call to the remote service. {@code status} is the HTTP status, or 0 when the
 * request never got a response.
 */
public class RemoteException extends RuntimeException {

    private final int status;

    public RemoteException(int status, String message) {
        super(message);
        this.status = status;
    }

    public RemoteException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }
}
