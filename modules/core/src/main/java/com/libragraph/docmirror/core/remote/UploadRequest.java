package com.libragraph.docmirror.core.remote;

import java.nio.file.Path;
import java.util.List;

/**
 * @param mimeType type hint for the remote, or null to let it infer one
 */
public record UploadRequest(
        Path file,
        String displayName,
        String mimeType,
        List<CustomMetadata> customMetadata
) {}
