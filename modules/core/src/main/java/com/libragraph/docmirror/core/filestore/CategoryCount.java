package com.libragraph.docmirror.core.filestore;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * Per-category document totals; the empty string stands for uncategorized documents.
 */
public record CategoryCount(
        @ColumnName("category") String category,
        @ColumnName("document_count") long documentCount,
        @ColumnName("total_size") long totalSize
) {}
