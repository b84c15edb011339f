package com.libragraph.docmirror.core.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteDocument(
        String name,
        String displayName,
        List<CustomMetadata> customMetadata,
        Long sizeBytes,
        String mimeType,
        String createTime,
        String updateTime,
        String state
) {

    public RemoteDocument {
        customMetadata = customMetadata == null ? List.of() : List.copyOf(customMetadata);
    }

    public Optional<CustomMetadata> metadata(String key) {
        return customMetadata.stream().filter(m -> key.equals(m.key())).findFirst();
    }

    public Optional<String> metadataText(String key) {
        return metadata(key).map(CustomMetadata::text);
    }

    public boolean hasMetadata(String key) {
        return metadata(key).isPresent();
    }

    /** {@code category/displayName}, or just the display name when uncategorized. */
    public String label() {
        String category = metadataText(CustomMetadata.CATEGORY).orElse("");
        return category.isEmpty() ? displayName : category + "/" + displayName;
    }
}
