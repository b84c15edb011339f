package com.libragraph.docmirror.core.dao;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Filter, sort and paging options for listing documents. Every filter is optional; the owner
 * scope is applied by the caller.
 */
public final class DocumentQuery {

    public static final int DEFAULT_TAKE = 50;
    public static final int MAX_TAKE = 1000;

    private Long filestoreId;
    private String category;
    private String hash;
    private String displayName;
    private String q;
    private final List<Long> ids = new ArrayList<>();
    private final List<String> displayNames = new ArrayList<>();
    private final List<String> nullColumns = new ArrayList<>();
    private final List<String> notNullColumns = new ArrayList<>();
    private String orderBy = "-id";
    private int skip;
    private int take = DEFAULT_TAKE;

    public static DocumentQuery all() {
        return new DocumentQuery();
    }

    public DocumentQuery filestoreId(Long filestoreId) {
        this.filestoreId = filestoreId;
        return this;
    }

    public DocumentQuery category(String category) {
        this.category = category;
        return this;
    }

    public DocumentQuery hash(String hash) {
        this.hash = hash;
        return this;
    }

    public DocumentQuery displayName(String displayName) {
        this.displayName = displayName;
        return this;
    }

    /** Substring match on the display name. */
    public DocumentQuery search(String q) {
        this.q = q;
        return this;
    }

    public DocumentQuery ids(Collection<Long> ids) {
        this.ids.addAll(ids);
        return this;
    }

    public DocumentQuery displayNames(Collection<String> displayNames) {
        this.displayNames.addAll(displayNames);
        return this;
    }

    public DocumentQuery whereNull(String column) {
        nullColumns.add(column);
        return this;
    }

    public DocumentQuery whereNotNull(String column) {
        notNullColumns.add(column);
        return this;
    }

    /**
     * {@code -id} (default), a column name with an optional leading {@code -} for descending,
     * or one of {@code failed}, {@code uploading}, {@code issues}.
     */
    public DocumentQuery orderBy(String orderBy) {
        this.orderBy = orderBy;
        return this;
    }

    public DocumentQuery skip(int skip) {
        this.skip = Math.max(0, skip);
        return this;
    }

    public DocumentQuery take(int take) {
        this.take = take <= 0 ? DEFAULT_TAKE : Math.min(take, MAX_TAKE);
        return this;
    }

    public Long filestoreId() { return filestoreId; }
    public String category() { return category; }
    public String hash() { return hash; }
    public String displayName() { return displayName; }
    public String q() { return q; }
    public List<Long> ids() { return ids; }
    public List<String> displayNames() { return displayNames; }
    public List<String> nullColumns() { return nullColumns; }
    public List<String> notNullColumns() { return notNullColumns; }
    public String orderBy() { return orderBy; }
    public int skip() { return skip; }
    public int take() { return take; }
}
