package com.libragraph.docmirror.core.document;

/**
 * Upload lifecycle of a document. Labels match the remote API's state names.
 */
public enum DocumentState {
    PENDING("STATE_PENDING"),
    ACTIVE("STATE_ACTIVE"),
    FAILED("STATE_FAILED");

    private final String label;

    DocumentState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DocumentState fromLabel(String label) {
        for (DocumentState s : values()) {
            if (s.label.equals(label)) return s;
        }
        throw new IllegalArgumentException("Unknown DocumentState label: " + label);
    }
}
