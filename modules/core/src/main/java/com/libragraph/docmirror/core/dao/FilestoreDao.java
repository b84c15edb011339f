package com.libragraph.docmirror.core.dao;

import com.libragraph.docmirror.core.filestore.FilestoreRecord;
import com.libragraph.docmirror.core.filestore.NewFilestore;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(FilestoreRecord.class)
public interface FilestoreDao {

    @SqlUpdate("INSERT INTO filestore (owner, created_at, updated_at, name, display_name, create_time, update_time) " +
            "VALUES (:owner, :now, :now, :name, :displayName, :createTime, :updateTime)")
    @GetGeneratedKeys("id")
    long insert(@BindMethods NewFilestore filestore);

    @SqlQuery("SELECT * FROM filestore WHERE id = :id")
    Optional<FilestoreRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM filestore ORDER BY id")
    List<FilestoreRecord> findAll();

    @SqlUpdate("UPDATE filestore SET active_documents_count = :active, pending_documents_count = :pending, " +
            "failed_documents_count = :failed, size_bytes = :sizeBytes, updated_at = :now WHERE id = :id")
    int updateStats(@Bind("id") long id,
                    @Bind("active") long active,
                    @Bind("pending") long pending,
                    @Bind("failed") long failed,
                    @Bind("sizeBytes") long sizeBytes,
                    @Bind("now") Instant now);

    @SqlUpdate("DELETE FROM filestore WHERE id = :id")
    int deleteById(@Bind("id") long id);
}
