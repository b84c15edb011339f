package com.libragraph.docmirror.core.stats;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * Derived document counters of one filestore.
 */
public record FilestoreStats(
        @ColumnName("active") long active,
        @ColumnName("pending") long pending,
        @ColumnName("failed") long failed,
        @ColumnName("size_bytes") long sizeBytes
) {}
