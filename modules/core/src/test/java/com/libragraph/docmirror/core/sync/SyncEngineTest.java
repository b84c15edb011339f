package com.libragraph.docmirror.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docmirror.core.dao.DocumentQuery;
import com.libragraph.docmirror.core.document.DocumentRecord;
import com.libragraph.docmirror.core.document.SyncIssue;
import com.libragraph.docmirror.core.filestore.FilestoreNotFoundException;
import com.libragraph.docmirror.core.filestore.FilestoreRecord;
import com.libragraph.docmirror.core.remote.CustomMetadata;
import com.libragraph.docmirror.core.remote.RemoteDocument;
import com.libragraph.docmirror.core.test.MirrorTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncEngineTest {

    @TempDir
    Path cache;

    MirrorTestFixture fx;
    FilestoreRecord filestore;

    @BeforeEach
    void setUp() {
        fx = new MirrorTestFixture(cache);
        filestore = fx.filestore("store");
    }

    @Test
    void sync_threeDocumentScenario() {
        DocumentRecord h1 = fx.ingest(filestore.id(), "one.txt", "first");
        DocumentRecord h2 = fx.ingest(filestore.id(), "two.txt", "second");
        DocumentRecord h3 = fx.ingest(filestore.id(), "three.txt", "third");
        fx.remote.put(filestore.name(), "one.txt", CustomMetadata.forDocument(h1.id(), h1.hash(), null));
        fx.remote.put(filestore.name(), "two.txt", List.of());
        fx.remote.put(filestore.name(), "orphan.pdf", List.of());

        SyncReport report = fx.sync.sync(filestore.id());

        assertThat(report.missingMetadata().count()).isEqualTo(1);
        assertThat(report.missingMetadata().docs()).containsExactly("two.txt");
        assertThat(report.missingFromLocal().count()).isEqualTo(1);
        assertThat(report.missingFromLocal().docs()).containsExactly("orphan.pdf");
        assertThat(report.missingFromRemote().count()).isEqualTo(1);
        assertThat(report.missingFromRemote().docs()).containsExactly("three.txt");
        assertThat(report.summary().matchedDocuments()).isEqualTo(1);
        assertThat(report.summary().localDocuments()).isEqualTo(3);
        assertThat(report.summary().remoteDocuments()).isEqualTo(3);

        assertThat(fx.reload(h1.id()).issue()).isNull();
        assertThat(fx.reload(h2.id()).issue()).isEqualTo(SyncIssue.MISSING_METADATA);
        assertThat(fx.reload(h3.id()).issue()).isEqualTo(SyncIssue.MISSING_FROM_REMOTE);
        assertThat(fx.reload(h3.id()).displayState()).isEqualTo("MISSING_FROM_REMOTE");
    }

    @Test
    void sync_hashTakesPrecedenceOverName() {
        DocumentRecord a = fx.ingest(filestore.id(), "a.txt", "alpha");
        DocumentRecord b = fx.ingest(filestore.id(), "b.txt", "beta");
        fx.remote.put(filestore.name(), "b.txt", CustomMetadata.forDocument(a.id(), a.hash(), null));

        SyncReport report = fx.sync.sync(filestore.id());

        assertThat(report.summary().matchedDocuments()).isEqualTo(1);
        assertThat(report.missingFromRemote().docs()).containsExactly("b.txt");
        assertThat(fx.reload(a.id()).issue()).isNull();
        assertThat(fx.reload(b.id()).issue()).isEqualTo(SyncIssue.MISSING_FROM_REMOTE);
    }

    @Test
    void sync_isIdempotent() {
        DocumentRecord a = fx.ingest(filestore.id(), "a.txt", "alpha");
        DocumentRecord b = fx.ingest(filestore.id(), "b.txt", "beta");
        fx.ingest(filestore.id(), "c.txt", "gamma");
        fx.remote.put(filestore.name(), "a.txt", CustomMetadata.forDocument(a.id() + 100, a.hash(), null));
        fx.remote.put(filestore.name(), "b.txt", List.of());

        SyncReport first = fx.sync.sync(filestore.id());
        List<DocumentRecord> afterFirst = fx.documents.query(null, DocumentQuery.all());
        SyncReport second = fx.sync.sync(filestore.id());
        List<DocumentRecord> afterSecond = fx.documents.query(null, DocumentQuery.all());

        assertThat(second).isEqualTo(first);
        assertThat(second.metadataMismatch().count()).isEqualTo(1);
        assertThat(second.missingMetadata().count()).isEqualTo(1);
        assertThat(afterSecond).extracting(DocumentRecord::issue)
                .containsExactlyElementsOf(afterFirst.stream().map(DocumentRecord::issue).toList());
        assertThat(afterSecond).extracting(DocumentRecord::updatedAt)
                .containsExactlyElementsOf(afterFirst.stream().map(DocumentRecord::updatedAt).toList());
        assertThat(fx.reload(b.id()).issue()).isEqualTo(SyncIssue.MISSING_METADATA);
    }

    @Test
    void sync_uploadedDocumentsMatchCleanly() {
        fx.ingest(filestore.id(), "guides", "a.txt", "alpha");
        fx.ingest(filestore.id(), "b.txt", "beta");
        fx.executor.runAll();

        SyncReport report = fx.sync.sync(filestore.id());

        assertThat(report.summary().matchedDocuments()).isEqualTo(2);
        assertThat(report.unmatchedFields().count()).isZero();
        assertThat(report.metadataMismatch().count()).isZero();
        assertThat(report.missingFromLocal().count()).isZero();
        assertThat(report.missingFromRemote().count()).isZero();
    }

    @Test
    void sync_metadataMismatch_flaggedThenClearedWhenFixed() {
        DocumentRecord a = fx.ingest(filestore.id(), "a.txt", "alpha");
        RemoteDocument wrong = fx.remote.put(filestore.name(), "a.txt",
                List.of(CustomMetadata.ofNumber("id", 999), CustomMetadata.ofString("hash", "deadbeef"),
                        CustomMetadata.ofString("category", "")));

        SyncReport report = fx.sync.sync(filestore.id());

        assertThat(report.metadataMismatch().docs()).containsExactly("a.txt");
        assertThat(report.summary().matchedDocuments()).isEqualTo(1);
        assertThat(fx.reload(a.id()).issue()).isEqualTo(SyncIssue.METADATA_MISMATCH);

        fx.remote.removeDocument(wrong.name());
        fx.remote.put(filestore.name(), "a.txt", CustomMetadata.forDocument(a.id(), a.hash(), null));
        fx.sync.sync(filestore.id());

        assertThat(fx.reload(a.id()).issue()).isNull();
    }

    @Test
    void sync_secondRemoteForSameLocal_isDuplicate() {
        DocumentRecord a = fx.ingest(filestore.id(), "a.txt", "alpha");
        fx.remote.put(filestore.name(), "a.txt", CustomMetadata.forDocument(a.id(), a.hash(), null));
        fx.remote.put(filestore.name(), "a.txt", CustomMetadata.forDocument(a.id(), a.hash(), null));

        SyncReport report = fx.sync.sync(filestore.id());

        assertThat(report.duplicateDocuments().count()).isEqualTo(1);
        assertThat(report.summary().matchedDocuments()).isEqualTo(1);
        assertThat(report.missingFromLocal().count()).isZero();
        assertThat(fx.reload(a.id()).issue()).isEqualTo(SyncIssue.DUPLICATE_FILE);
    }

    @Test
    void sync_bucketSamplesBoundedButCountComplete() {
        for (int i = 0; i < 7; i++) {
            fx.ingest(filestore.id(), "docs", "doc-" + i + ".txt", "content " + i);
        }

        SyncReport report = fx.sync.sync(filestore.id());

        assertThat(report.missingFromRemote().count()).isEqualTo(7);
        assertThat(report.missingFromRemote().docs())
                .containsExactly("docs/doc-0.txt", "docs/doc-1.txt", "docs/doc-2.txt", "docs/doc-3.txt", "docs/doc-4.txt");
    }

    @Test
    void sync_updatesStatsAfterwards() {
        fx.ingest(filestore.id(), "a.txt", "alpha");
        fx.jdbi.useHandle(h -> h.execute("UPDATE filestore SET pending_documents_count = 99 WHERE id = ?",
                filestore.id()));

        fx.sync.sync(filestore.id());

        assertThat(fx.reloadFilestore(filestore.id()).pendingDocumentsCount()).isEqualTo(1);
    }

    @Test
    void sync_reportSerializesWithDisplayKeys() throws Exception {
        fx.ingest(filestore.id(), "a.txt", "alpha");

        JsonNode json = new ObjectMapper().valueToTree(fx.sync.sync(filestore.id()));

        assertThat(json.fieldNames()).toIterable().containsExactly("Missing from Local", "Missing from Gemini",
                "Missing Metadata", "Metadata Mismatch", "Unmatched Fields", "Duplicate Documents", "Summary");
        assertThat(json.get("Missing from Gemini").get("count").asInt()).isEqualTo(1);
        assertThat(json.get("Missing from Gemini").get("docs").get(0).asText()).isEqualTo("a.txt");
        assertThat(json.get("Summary").get("Local Documents").asInt()).isEqualTo(1);
        assertThat(json.get("Summary").get("Matched Documents").asInt()).isZero();
    }

    @Test
    void sync_unknownFilestore_throws() {
        assertThatThrownBy(() -> fx.sync.sync(4242)).isInstanceOf(FilestoreNotFoundException.class);
    }
}
