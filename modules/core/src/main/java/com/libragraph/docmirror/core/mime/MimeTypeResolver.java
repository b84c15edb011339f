package com.libragraph.docmirror.core.mime;

import com.libragraph.docmirror.core.config.MirrorConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.tika.Tika;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Name-based MIME type detection plus the upload type rules: configured per-extension overrides
 * win, and types the remote rejects as upload hints are left out.
 */
@ApplicationScoped
public class MimeTypeResolver {

    private static final Logger log = Logger.getLogger(MimeTypeResolver.class);

    static final String OCTET_STREAM = "application/octet-stream";
    static final String JSON = "application/json";

    private final Tika tika = new Tika();
    private Map<String, String> overrides;

    @Inject
    public MimeTypeResolver(MirrorConfig config) {
        this(parseOverrides(config.uploadMimeTypes()));
    }

    public MimeTypeResolver(Map<String, String> overrides) {
        this.overrides = Map.copyOf(overrides);
    }

    /** Detected type of a file name, {@code application/octet-stream} when unknown. */
    public String detect(String filename) {
        String override = override(filename);
        if (override != null) return override;
        if (filename == null || filename.isBlank()) return OCTET_STREAM;
        return tika.detect(filename);
    }

    /**
     * Type to send with an upload, or empty to let the remote infer it.
     */
    public Optional<String> uploadMimeType(String filename) {
        String override = override(filename);
        if (override != null) return Optional.of(override);
        String detected = detect(filename);
        if (JSON.equals(detected) || OCTET_STREAM.equals(detected)) {
            return Optional.empty();
        }
        return Optional.of(detected);
    }

    /** Preferred extension for a type, without the dot, or null. */
    public String extensionFor(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) return null;
        try {
            String ext = MimeTypes.getDefaultMimeTypes().forName(mimeType).getExtension();
            return ext == null || ext.isEmpty() ? null : ext.substring(1);
        } catch (MimeTypeException e) {
            log.debugf("Unknown MIME type %s: %s", mimeType, e.getMessage());
            return null;
        }
    }

    Map<String, String> overrides() {
        return overrides;
    }

    private String override(String filename) {
        String ext = extensionOf(filename);
        return ext == null ? null : overrides.get(ext);
    }

    /** Lower-cased extension of the last path segment, or null. */
    public static String extensionOf(String filename) {
        if (filename == null) return null;
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String base = filename.substring(slash + 1);
        int dot = base.lastIndexOf('.');
        if (dot <= 0 || dot == base.length() - 1) return null;
        return base.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code ext:type,ext:type}. Malformed entries are skipped with a warning.
     */
    public static Map<String, String> parseOverrides(String raw) {
        if (raw == null || raw.isBlank()) return Collections.emptyMap();
        Map<String, String> result = new LinkedHashMap<>();
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) continue;
            int colon = trimmed.indexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                log.warnf("Ignoring malformed upload MIME type mapping '%s'", trimmed);
                continue;
            }
            String ext = trimmed.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (ext.startsWith(".")) ext = ext.substring(1);
            result.put(ext, trimmed.substring(colon + 1).trim());
        }
        return result;
    }
}
