package com.libragraph.docmirror.core.document;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record DocumentRecord(
        @ColumnName("id") long id,
        @ColumnName("filestore_id") long filestoreId,
        @ColumnName("owner") String owner,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("filename") String filename,
        @ColumnName("url") String url,
        @ColumnName("hash") String hash,
        @ColumnName("size") long size,
        @ColumnName("display_name") String displayName,
        @ColumnName("name") String name,
        @ColumnName("custom_metadata") String customMetadata,
        @ColumnName("create_time") String createTime,
        @ColumnName("update_time") String updateTime,
        @ColumnName("size_bytes") Long sizeBytes,
        @ColumnName("mime_type") String mimeType,
        @ColumnName("state") DocumentState state,
        @ColumnName("issue") SyncIssue issue,
        @ColumnName("category") String category,
        @ColumnName("tags") String tags,
        @ColumnName("started_at") Instant startedAt,
        @ColumnName("uploaded_at") Instant uploadedAt,
        @ColumnName("metadata") String metadata,
        @ColumnName("error") String error,
        @ColumnName("ref") String ref
) {

    /** The sync issue when one is set, otherwise the upload state label. */
    public String displayState() {
        return issue != null ? issue.name() : state.label();
    }

    /** {@code category/displayName}, or just the display name when uncategorized. */
    public String label() {
        return category == null || category.isEmpty() ? displayName : category + "/" + displayName;
    }

    public boolean inFlight() {
        return state == DocumentState.PENDING && startedAt != null;
    }
}
