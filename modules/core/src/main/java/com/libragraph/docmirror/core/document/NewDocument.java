package com.libragraph.docmirror.core.document;

import java.time.Instant;

/**
 * Column values for a freshly ingested document row.
 */
public record NewDocument(
        long filestoreId,
        String owner,
        String filename,
        String url,
        String hash,
        long size,
        String displayName,
        String mimeType,
        String category,
        DocumentState state,
        Instant now
) {}
