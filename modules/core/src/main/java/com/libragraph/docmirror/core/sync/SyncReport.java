package com.libragraph.docmirror.core.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Outcome of comparing a filestore with its remote store.
 */
@JsonPropertyOrder({"Missing from Local", "Missing from Gemini", "Missing Metadata",
        "Metadata Mismatch", "Unmatched Fields", "Duplicate Documents", "Summary"})
public record SyncReport(
        @JsonProperty("Missing from Local") Bucket missingFromLocal,
        @JsonProperty("Missing from Gemini") Bucket missingFromRemote,
        @JsonProperty("Missing Metadata") Bucket missingMetadata,
        @JsonProperty("Metadata Mismatch") Bucket metadataMismatch,
        @JsonProperty("Unmatched Fields") Bucket unmatchedFields,
        @JsonProperty("Duplicate Documents") Bucket duplicateDocuments,
        @JsonProperty("Summary") Summary summary
) {

    /**
     * @param count total members
     * @param docs  labels of the first few members
     */
    public record Bucket(
            @JsonProperty("count") int count,
            @JsonProperty("docs") List<String> docs
    ) {
        static Bucket of(List<String> labels, int sampleSize) {
            return new Bucket(labels.size(), List.copyOf(labels.subList(0, Math.min(sampleSize, labels.size()))));
        }
    }

    public record Summary(
            @JsonProperty("Local Documents") int localDocuments,
            @JsonProperty("Remote Documents") int remoteDocuments,
            @JsonProperty("Matched Documents") int matchedDocuments
    ) {}
}
