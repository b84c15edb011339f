package com.libragraph.docmirror.core.remote;

public class RemoteNotFoundException extends RemoteException {

    public RemoteNotFoundException(String message) {
        super(404, message);
    }
}
