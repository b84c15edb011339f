package com.libragraph.docmirror.core.dao;

import com.libragraph.docmirror.core.document.DocumentRecord;
import com.libragraph.docmirror.core.document.DocumentState;
import com.libragraph.docmirror.core.filestore.FilestoreRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.reflect.ConstructorMapper;
import org.jdbi.v3.core.statement.Query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Filtered, sorted and paged listings. Column names from callers are checked against a
 * whitelist before they reach SQL.
 */
@ApplicationScoped
public class DocumentRepository {

    private static final Map<String, String> DOCUMENT_COLUMNS = columns(
            "id", "filestore_id", "owner", "created_at", "updated_at", "filename", "url", "hash", "size",
            "display_name", "name", "create_time", "update_time", "size_bytes", "mime_type", "state",
            "issue", "category", "tags", "started_at", "uploaded_at", "error", "ref");

    private static final Map<String, String> FILESTORE_COLUMNS = columns(
            "id", "owner", "created_at", "updated_at", "name", "display_name", "create_time", "update_time",
            "active_documents_count", "pending_documents_count", "failed_documents_count", "size_bytes");

    private Jdbi jdbi;

    @Inject
    public DocumentRepository(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    public List<DocumentRecord> query(String owner, DocumentQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM document WHERE ");
        sql.append(owner == null ? "owner IS NULL" : "owner = :owner");
        if (query.filestoreId() != null) sql.append(" AND filestore_id = :filestoreId");
        if (query.category() != null) sql.append(" AND category = :category");
        if (query.hash() != null) sql.append(" AND hash = :hash");
        if (query.displayName() != null) sql.append(" AND display_name = :displayName");
        if (query.q() != null && !query.q().isBlank()) sql.append(" AND LOWER(display_name) LIKE :q");
        if (!query.ids().isEmpty()) sql.append(" AND id IN (<ids>)");
        if (!query.displayNames().isEmpty()) sql.append(" AND display_name IN (<displayNames>)");
        for (String column : query.nullColumns()) {
            sql.append(" AND ").append(column(DOCUMENT_COLUMNS, column)).append(" IS NULL");
        }
        for (String column : query.notNullColumns()) {
            sql.append(" AND ").append(column(DOCUMENT_COLUMNS, column)).append(" IS NOT NULL");
        }
        sql.append(" ORDER BY ").append(documentOrder(query.orderBy()));
        sql.append(" LIMIT :take OFFSET :skip");

        return jdbi.withHandle(handle -> {
            Query q = handle.createQuery(sql.toString())
                    .registerColumnMapper(new DocumentStateColumnMapper())
                    .registerRowMapper(ConstructorMapper.factory(DocumentRecord.class))
                    .bind("take", query.take())
                    .bind("skip", query.skip());
            if (owner != null) q.bind("owner", owner);
            if (query.filestoreId() != null) q.bind("filestoreId", query.filestoreId());
            if (query.category() != null) q.bind("category", query.category());
            if (query.hash() != null) q.bind("hash", query.hash());
            if (query.displayName() != null) q.bind("displayName", query.displayName());
            if (query.q() != null && !query.q().isBlank()) q.bind("q", like(query.q()));
            if (!query.ids().isEmpty()) q.bindList("ids", query.ids());
            if (!query.displayNames().isEmpty()) q.bindList("displayNames", query.displayNames());
            return q.mapTo(DocumentRecord.class).list();
        });
    }

    public List<FilestoreRecord> queryFilestores(String owner, FilestoreQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM filestore WHERE ");
        sql.append(owner == null ? "owner IS NULL" : "owner = :owner");
        if (query.q() != null && !query.q().isBlank()) sql.append(" AND LOWER(display_name) LIKE :q");
        sql.append(" ORDER BY ").append(columnOrder(FILESTORE_COLUMNS, query.orderBy()));
        sql.append(" LIMIT :take OFFSET :skip");

        return jdbi.withHandle(handle -> {
            Query q = handle.createQuery(sql.toString())
                    .registerRowMapper(ConstructorMapper.factory(FilestoreRecord.class))
                    .bind("take", query.take())
                    .bind("skip", query.skip());
            if (owner != null) q.bind("owner", owner);
            if (query.q() != null && !query.q().isBlank()) q.bind("q", like(query.q()));
            return q.mapTo(FilestoreRecord.class).list();
        });
    }

    static String documentOrder(String orderBy) {
        String key = orderBy == null || orderBy.isBlank() ? "-id" : orderBy.trim();
        switch (key) {
            case "failed":
                return "CASE WHEN error IS NOT NULL AND error <> '' THEN 0 ELSE 1 END, id DESC";
            case "uploading":
                return "CASE WHEN state = '" + DocumentState.PENDING.label()
                        + "' AND started_at IS NOT NULL THEN 0 ELSE 1 END, uploaded_at DESC NULLS LAST, id DESC";
            case "issues":
                return "CASE WHEN issue IS NOT NULL THEN 0 ELSE 1 END, id DESC";
            default:
                return columnOrder(DOCUMENT_COLUMNS, key);
        }
    }

    private static String columnOrder(Map<String, String> whitelist, String orderBy) {
        String key = orderBy == null || orderBy.isBlank() ? "-id" : orderBy.trim();
        boolean descending = key.startsWith("-");
        String column = column(whitelist, descending ? key.substring(1) : key);
        String order = column + (descending ? " DESC" : " ASC");
        return column.equals("id") ? order : order + ", id DESC";
    }

    private static String column(Map<String, String> whitelist, String name) {
        String column = whitelist.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return column;
    }

    private static String like(String q) {
        String escaped = q.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    /** Accepts both snake_case and camelCase spellings of each column. */
    private static Map<String, String> columns(String... names) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : names) {
            map.put(name, name);
            map.put(camel(name), name);
        }
        return map;
    }

    private static String camel(String snake) {
        StringBuilder out = new StringBuilder();
        boolean upper = false;
        for (char c : snake.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }
}
