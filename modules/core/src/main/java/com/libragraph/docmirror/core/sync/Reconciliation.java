package com.libragraph.docmirror.core.sync;

import com.libragraph.docmirror.core.document.DocumentRecord;
import com.libragraph.docmirror.core.document.SyncIssue;
import com.libragraph.docmirror.core.remote.CustomMetadata;
import com.libragraph.docmirror.core.remote.RemoteDocument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Pure matching of one local snapshot against one remote snapshot. Feed every remote document
 * through {@link #accept}, then read the buckets and the per-document issue outcome.
 */
final class Reconciliation {

    private final List<DocumentRecord> locals;
    private final NameTieBreak tieBreak;

    private final Map<String, DocumentRecord> byHash = new HashMap<>();
    private final Map<String, DocumentRecord> byName = new HashMap<>();
    private final Map<String, List<DocumentRecord>> byDisplayName = new HashMap<>();

    private final Set<Long> matched = new HashSet<>();
    private final Map<Long, SyncIssue> outcome = new HashMap<>();

    private final List<String> missingFromLocal = new ArrayList<>();
    private final List<String> missingMetadata = new ArrayList<>();
    private final List<String> metadataMismatch = new ArrayList<>();
    private final List<String> unmatchedFields = new ArrayList<>();
    private final List<String> duplicates = new ArrayList<>();
    private int remoteCount;
    private int matchedCount;

    Reconciliation(List<DocumentRecord> locals, NameTieBreak tieBreak) {
        this.locals = locals;
        this.tieBreak = tieBreak;
        for (DocumentRecord local : locals) {
            byHash.putIfAbsent(local.hash(), local);
            if (local.name() != null) byName.putIfAbsent(local.name(), local);
            byDisplayName.computeIfAbsent(local.displayName(), k -> new ArrayList<>()).add(local);
        }
    }

    void accept(RemoteDocument remote) {
        remoteCount++;
        DocumentRecord local = match(remote);
        if (local == null) {
            missingFromLocal.add(remote.label());
            return;
        }
        if (!matched.add(local.id())) {
            duplicates.add(remote.label());
            outcome.put(local.id(), SyncIssue.DUPLICATE_FILE);
            return;
        }

        if (!sameFields(remote, local)) {
            unmatchedFields.add(remote.label());
        }

        if (!remote.hasMetadata(CustomMetadata.ID) || !remote.hasMetadata(CustomMetadata.HASH)
                || !remote.hasMetadata(CustomMetadata.CATEGORY)) {
            missingMetadata.add(remote.label());
            outcome.put(local.id(), SyncIssue.MISSING_METADATA);
            return;
        }

        matchedCount++;
        boolean idAgrees = remote.metadataText(CustomMetadata.ID)
                .map(id -> id.equals(Long.toString(local.id()))).orElse(false);
        boolean hashAgrees = remote.metadataText(CustomMetadata.HASH)
                .map(hash -> hash.equals(local.hash())).orElse(false);
        if (!idAgrees || !hashAgrees) {
            metadataMismatch.add(remote.label());
            outcome.put(local.id(), SyncIssue.METADATA_MISMATCH);
        } else {
            outcome.put(local.id(), null);
        }
    }

    private DocumentRecord match(RemoteDocument remote) {
        Optional<String> hash = remote.metadataText(CustomMetadata.HASH);
        if (hash.isPresent() && byHash.containsKey(hash.get())) {
            return byHash.get(hash.get());
        }
        if (remote.name() != null && byName.containsKey(remote.name())) {
            return byName.get(remote.name());
        }
        List<DocumentRecord> candidates = byDisplayName.get(remote.displayName());
        if (candidates != null) {
            return tieBreak.choose(candidates, matched);
        }
        return null;
    }

    private static boolean sameFields(RemoteDocument remote, DocumentRecord local) {
        return Objects.equals(remote.name(), local.name())
                && Objects.equals(remote.displayName(), local.displayName())
                && Objects.equals(remote.sizeBytes(), local.sizeBytes())
                && Objects.equals(remote.mimeType(), local.mimeType());
    }

    /** Issue each local document should carry after this sync; null means none. */
    Map<Long, SyncIssue> issues() {
        Map<Long, SyncIssue> issues = new LinkedHashMap<>();
        for (DocumentRecord local : locals) {
            issues.put(local.id(), matched.contains(local.id())
                    ? outcome.get(local.id())
                    : SyncIssue.MISSING_FROM_REMOTE);
        }
        return issues;
    }

    SyncReport report(int sampleSize) {
        List<String> missingFromRemote = new ArrayList<>();
        for (DocumentRecord local : locals) {
            if (!matched.contains(local.id())) missingFromRemote.add(local.label());
        }
        return new SyncReport(
                SyncReport.Bucket.of(missingFromLocal, sampleSize),
                SyncReport.Bucket.of(missingFromRemote, sampleSize),
                SyncReport.Bucket.of(missingMetadata, sampleSize),
                SyncReport.Bucket.of(metadataMismatch, sampleSize),
                SyncReport.Bucket.of(unmatchedFields, sampleSize),
                SyncReport.Bucket.of(duplicates, sampleSize),
                new SyncReport.Summary(locals.size(), remoteCount, matchedCount));
    }
}
