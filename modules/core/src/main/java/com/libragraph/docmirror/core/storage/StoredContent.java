package com.libragraph.docmirror.core.storage;

import com.libragraph.docmirror.util.ContentHash;

/**
 * Result of writing an upload into the cache.
 *
 * @param filename     saved file name, {@code <hex>.<ext>}
 * @param relativePath path below the cache root
 * @param url          public {@code /~cache/...} URL of the file
 * @param created      false when identical content was already cached
 */
public record StoredContent(
        ContentHash hash,
        String extension,
        String filename,
        String relativePath,
        String url,
        long size,
        String mimeType,
        boolean created
) {}
