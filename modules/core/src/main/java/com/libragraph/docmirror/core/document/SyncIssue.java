package com.libragraph.docmirror.core.document;

/**
 * Divergence marker written by sync. Shown in place of the upload state while set.
 */
public enum SyncIssue {
    MISSING_METADATA,
    DUPLICATE_FILE,
    MISSING_FROM_REMOTE,
    METADATA_MISMATCH
}
