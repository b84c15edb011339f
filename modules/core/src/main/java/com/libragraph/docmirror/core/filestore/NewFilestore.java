package com.libragraph.docmirror.core.filestore;

import java.time.Instant;

public record NewFilestore(
        String owner,
        String name,
        String displayName,
        String createTime,
        String updateTime,
        Instant now
) {}
