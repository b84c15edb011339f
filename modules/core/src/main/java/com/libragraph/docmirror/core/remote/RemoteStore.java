package com.libragraph.docmirror.core.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteStore(
        String name,
        String displayName,
        String createTime,
        String updateTime,
        Long activeDocumentsCount,
        Long pendingDocumentsCount,
        Long failedDocumentsCount,
        Long sizeBytes
) {}
