package com.libragraph.docmirror.core.remote;

/**
 * A long-running remote operation.
 *
 * @param documentName resource name of the created document, once done
 * @param errorMessage set when the operation finished unsuccessfully
 */
public record RemoteOperation(
        String name,
        boolean done,
        String documentName,
        String errorMessage
) {

    public boolean failed() {
        return done && errorMessage != null;
    }
}
