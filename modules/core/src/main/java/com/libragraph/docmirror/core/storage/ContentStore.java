package com.libragraph.docmirror.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docmirror.core.config.MirrorConfig;
import com.libragraph.docmirror.core.mime.MimeTypeResolver;
import com.libragraph.docmirror.util.ContentHash;
import com.libragraph.docmirror.util.HashingInputStream;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Content-addressed file cache.
 *
 * <p>Layout: {@code {root}/{hex[0:2]}/{hex}.{ext}} with a {@code {hex}.info.json} descriptor
 * beside each file. Identical bytes always land on the same path, so a repeated write is a no-op.
 */
@ApplicationScoped
public class ContentStore {

    private static final Logger log = Logger.getLogger(ContentStore.class);

    public static final String URL_PREFIX = "/~cache/";
    private static final int TIER_LENGTH = 2;
    private static final String FALLBACK_EXTENSION = "bin";
    private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,16}");

    private Path root;
    private ObjectMapper objectMapper;
    private MimeTypeResolver mimeTypes;

    @Inject
    public ContentStore(MirrorConfig config, ObjectMapper objectMapper, MimeTypeResolver mimeTypes) {
        this(Path.of(config.cacheRoot()), objectMapper, mimeTypes);
    }

    public ContentStore(Path root, ObjectMapper objectMapper, MimeTypeResolver mimeTypes) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.mimeTypes = mimeTypes;
    }

    public Path root() {
        return root;
    }

    /**
     * Streams {@code content} into the cache, hashing it on the way.
     */
    public StoredContent put(String filename, InputStream content) {
        Path tmp = null;
        try {
            Files.createDirectories(root);
            tmp = Files.createTempFile(root, "upload-", ".tmp");
            HashingInputStream in = new HashingInputStream(content);
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            ContentHash hash = in.hash();
            long size = in.count();

            String mimeType = mimeTypes.detect(filename);
            String extension = extension(filename, mimeType);
            String hex = hash.toHex();
            String savedName = hex + "." + extension;
            String relativePath = hash.prefix(TIER_LENGTH) + "/" + savedName;
            String url = URL_PREFIX + relativePath;
            Path target = root.resolve(relativePath);

            boolean created = false;
            if (!Files.exists(target)) {
                Files.createDirectories(target.getParent());
                moveInto(tmp, target);
                writeDescriptor(target.resolveSibling(hex + ".info.json"), url, size, mimeType, filename);
                created = true;
                log.debugf("Cached %s as %s (%d bytes)", filename, relativePath, size);
            } else {
                log.debugf("Content of %s already cached at %s", filename, relativePath);
            }
            return new StoredContent(hash, extension, savedName, relativePath, url, size, mimeType, created);
        } catch (IOException e) {
            throw new StorageException("Failed to cache upload: " + filename, e);
        } finally {
            if (tmp != null) deleteQuietly(tmp);
        }
    }

    /**
     * Maps a cache URL back to its file.
     *
     * @throws IllegalArgumentException for URLs outside the cache
     */
    public Path resolve(String url) {
        if (url == null || !url.startsWith(URL_PREFIX)) {
            throw new IllegalArgumentException("Not a cache URL: " + url);
        }
        Path path = root.resolve(url.substring(URL_PREFIX.length())).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Cache URL escapes the cache root: " + url);
        }
        return path;
    }

    public boolean exists(String url) {
        return Files.isRegularFile(resolve(url));
    }

    String extension(String filename, String mimeType) {
        String fromName = MimeTypeResolver.extensionOf(filename);
        if (fromName != null && EXTENSION.matcher(fromName).matches()) {
            return fromName;
        }
        String fromType = mimeTypes.extensionFor(mimeType);
        if (fromType != null && EXTENSION.matcher(fromType).matches()) {
            return fromType;
        }
        return FALLBACK_EXTENSION;
    }

    private static void moveInto(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void writeDescriptor(Path path, String url, long size, String mimeType, String name)
            throws IOException {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("date", System.currentTimeMillis() / 1000);
        info.put("url", url);
        info.put("size", size);
        info.put("type", mimeType);
        info.put("name", name);
        objectMapper.writeValue(path.toFile(), info);
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warnf(e, "Failed to remove temp file %s", tmp);
        }
    }
}
