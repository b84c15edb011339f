package com.libragraph.docmirror.core.dao;

public final class FilestoreQuery {

    private String q;
    private String orderBy = "-id";
    private int skip;
    private int take = DocumentQuery.DEFAULT_TAKE;

    public static FilestoreQuery all() {
        return new FilestoreQuery();
    }

    public FilestoreQuery search(String q) {
        this.q = q;
        return this;
    }

    public FilestoreQuery orderBy(String orderBy) {
        this.orderBy = orderBy;
        return this;
    }

    public FilestoreQuery skip(int skip) {
        this.skip = Math.max(0, skip);
        return this;
    }

    public FilestoreQuery take(int take) {
        this.take = take <= 0 ? DocumentQuery.DEFAULT_TAKE : Math.min(take, DocumentQuery.MAX_TAKE);
        return this;
    }

    public String q() { return q; }
    public String orderBy() { return orderBy; }
    public int skip() { return skip; }
    public int take() { return take; }
}
