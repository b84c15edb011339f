package com.libragraph.docmirror.core.upload;

public class OperationTimeoutException extends RuntimeException {

    private final String operationName;

    public OperationTimeoutException(String operationName, int attempts) {
        super("Operation " + operationName + " not done after " + attempts + " polls (timeout)");
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }
}
