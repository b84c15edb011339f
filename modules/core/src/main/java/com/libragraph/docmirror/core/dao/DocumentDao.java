package com.libragraph.docmirror.core.dao;

import com.libragraph.docmirror.core.document.DocumentRecord;
import com.libragraph.docmirror.core.document.DocumentState;
import com.libragraph.docmirror.core.document.NewDocument;
import com.libragraph.docmirror.core.filestore.CategoryCount;
import com.libragraph.docmirror.core.stats.FilestoreStats;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(DocumentStateColumnMapper.class)
@RegisterArgumentFactory(DocumentStateArgumentFactory.class)
@RegisterConstructorMapper(DocumentRecord.class)
@RegisterConstructorMapper(FilestoreStats.class)
@RegisterConstructorMapper(CategoryCount.class)
public interface DocumentDao {

    @SqlUpdate("INSERT INTO document (filestore_id, owner, created_at, updated_at, filename, url, hash, size, " +
            "display_name, mime_type, category, state) " +
            "VALUES (:filestoreId, :owner, :now, :now, :filename, :url, :hash, :size, " +
            ":displayName, :mimeType, :category, :state)")
    @GetGeneratedKeys("id")
    long insert(@BindMethods NewDocument document);

    @SqlQuery("SELECT * FROM document WHERE id = :id")
    Optional<DocumentRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM document WHERE filestore_id = :filestoreId ORDER BY id")
    List<DocumentRecord> findByFilestore(@Bind("filestoreId") long filestoreId);

    @SqlQuery("SELECT * FROM document WHERE filestore_id = :filestoreId AND hash = :hash ORDER BY id")
    List<DocumentRecord> findByFilestoreAndHash(@Bind("filestoreId") long filestoreId, @Bind("hash") String hash);

    @SqlUpdate("DELETE FROM document WHERE id = :id")
    int deleteById(@Bind("id") long id);

    @SqlUpdate("DELETE FROM document WHERE filestore_id = :filestoreId AND hash = :hash")
    int deleteByFilestoreAndHash(@Bind("filestoreId") long filestoreId, @Bind("hash") String hash);

    @SqlUpdate("DELETE FROM document WHERE filestore_id = :filestoreId")
    int deleteByFilestore(@Bind("filestoreId") long filestoreId);

    // --- upload queue ---

    @SqlQuery("SELECT id FROM document WHERE state = :pending AND started_at IS NULL " +
            "ORDER BY created_at, id LIMIT :limit")
    List<Long> findClaimable(@Bind("pending") DocumentState pending, @Bind("limit") int limit);

    @SqlQuery("SELECT COUNT(*) FROM document WHERE state = :pending AND started_at IS NULL")
    long countClaimable(@Bind("pending") DocumentState pending);

    /** Returns 1 when this caller won the claim, 0 when someone else holds it or it is no longer pending. */
    @SqlUpdate("UPDATE document SET started_at = :now, updated_at = :now " +
            "WHERE id = :id AND state = :pending AND started_at IS NULL")
    int claim(@Bind("id") long id, @Bind("pending") DocumentState pending, @Bind("now") Instant now);

    /** Resets a document for another upload and claims it, unless it is already in flight. */
    @SqlUpdate("UPDATE document SET state = :pending, error = NULL, uploaded_at = NULL, name = NULL, " +
            "started_at = :now, updated_at = :now " +
            "WHERE id = :id AND NOT (state = :pending AND started_at IS NOT NULL)")
    int resetAndClaim(@Bind("id") long id, @Bind("pending") DocumentState pending, @Bind("now") Instant now);

    @SqlUpdate("UPDATE document SET state = :active, name = :name, create_time = :createTime, " +
            "update_time = :updateTime, size_bytes = :sizeBytes, mime_type = COALESCE(:mimeType, mime_type), " +
            "custom_metadata = :customMetadata, issue = NULL, error = NULL, " +
            "uploaded_at = :now, updated_at = :now WHERE id = :id")
    int markUploaded(@Bind("id") long id,
                     @Bind("active") DocumentState active,
                     @Bind("name") String name,
                     @Bind("createTime") String createTime,
                     @Bind("updateTime") String updateTime,
                     @Bind("sizeBytes") Long sizeBytes,
                     @Bind("mimeType") String mimeType,
                     @Bind("customMetadata") String customMetadata,
                     @Bind("now") Instant now);

    @SqlUpdate("UPDATE document SET state = :failed, error = :error, uploaded_at = NULL, updated_at = :now " +
            "WHERE id = :id")
    int markFailed(@Bind("id") long id,
                   @Bind("failed") DocumentState failed,
                   @Bind("error") String error,
                   @Bind("now") Instant now);

    @SqlUpdate("UPDATE document SET started_at = NULL, updated_at = :now " +
            "WHERE state = :pending AND started_at < :cutoff")
    int releaseStaleClaims(@Bind("pending") DocumentState pending,
                           @Bind("cutoff") Instant cutoff,
                           @Bind("now") Instant now);

    // --- sync ---

    @SqlUpdate("UPDATE document SET issue = :issue, updated_at = :now WHERE id = :id")
    int updateIssue(@Bind("id") long id, @Bind("issue") String issue, @Bind("now") Instant now);

    // --- aggregates ---

    @SqlQuery("SELECT " +
            "COALESCE(SUM(CASE WHEN state = :active AND (error IS NULL OR error = '') THEN 1 ELSE 0 END), 0) AS active, " +
            "COALESCE(SUM(CASE WHEN state = :pending AND (error IS NULL OR error = '') THEN 1 ELSE 0 END), 0) AS pending, " +
            "COALESCE(SUM(CASE WHEN state = :failed OR (error IS NOT NULL AND error <> '') THEN 1 ELSE 0 END), 0) AS failed, " +
            "COALESCE(SUM(size), 0) AS size_bytes " +
            "FROM document WHERE filestore_id = :filestoreId")
    FilestoreStats stats(@Bind("filestoreId") long filestoreId,
                         @Bind("active") DocumentState active,
                         @Bind("pending") DocumentState pending,
                         @Bind("failed") DocumentState failed);

    @SqlQuery("SELECT COALESCE(category, '') AS category, COUNT(*) AS document_count, " +
            "COALESCE(SUM(size), 0) AS total_size " +
            "FROM document WHERE filestore_id = :filestoreId " +
            "GROUP BY COALESCE(category, '') ORDER BY COALESCE(category, '')")
    List<CategoryCount> categories(@Bind("filestoreId") long filestoreId);
}
