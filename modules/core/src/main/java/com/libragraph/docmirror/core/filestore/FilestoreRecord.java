package com.libragraph.docmirror.core.filestore;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record FilestoreRecord(
        @ColumnName("id") long id,
        @ColumnName("owner") String owner,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("name") String name,
        @ColumnName("display_name") String displayName,
        @ColumnName("create_time") String createTime,
        @ColumnName("update_time") String updateTime,
        @ColumnName("active_documents_count") long activeDocumentsCount,
        @ColumnName("pending_documents_count") long pendingDocumentsCount,
        @ColumnName("failed_documents_count") long failedDocumentsCount,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("metadata") String metadata,
        @ColumnName("error") String error,
        @ColumnName("ref") String ref
) {}
