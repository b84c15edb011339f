package com.libragraph.docmirror.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docmirror.core.mime.MimeTypeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentStoreTest {

    private static final String HELLO_SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @TempDir
    Path root;

    ObjectMapper objectMapper = new ObjectMapper();
    ContentStore store;

    @BeforeEach
    void setUp() {
        store = new ContentStore(root, objectMapper, new MimeTypeResolver(Map.of("mdx", "text/markdown")));
    }

    @Test
    void put_storesUnderHashPrefixDirectory() throws IOException {
        StoredContent stored = store.put("hello.txt", stream("hello"));

        assertThat(stored.hash().toHex()).isEqualTo(HELLO_SHA256);
        assertThat(stored.relativePath()).isEqualTo("2c/" + HELLO_SHA256 + ".txt");
        assertThat(stored.url()).isEqualTo("/~cache/2c/" + HELLO_SHA256 + ".txt");
        assertThat(stored.size()).isEqualTo(5);
        assertThat(stored.created()).isTrue();
        assertThat(Files.readString(root.resolve(stored.relativePath()))).isEqualTo("hello");
    }

    @Test
    void put_sameBytesDifferentNameSameExtension_samePath() {
        StoredContent first = store.put("a.txt", stream("same bytes"));
        StoredContent second = store.put("renamed.txt", stream("same bytes"));

        assertThat(second.hash()).isEqualTo(first.hash());
        assertThat(second.relativePath()).isEqualTo(first.relativePath());
        assertThat(second.created()).isFalse();
    }

    @Test
    void put_repeatedWrite_leavesSingleFileAndNoTempFiles() throws IOException {
        store.put("a.txt", stream("payload"));
        store.put("a.txt", stream("payload"));

        try (Stream<Path> files = Files.walk(root)) {
            assertThat(files.filter(Files::isRegularFile).map(p -> p.getFileName().toString()))
                    .hasSize(2)
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void put_writesDescriptorForNewContent() throws IOException {
        StoredContent stored = store.put("Report.TXT", stream("hello"));

        Path descriptor = root.resolve("2c").resolve(HELLO_SHA256 + ".info.json");
        JsonNode info = objectMapper.readTree(descriptor.toFile());
        assertThat(stored.extension()).isEqualTo("txt");
        assertThat(info.get("url").asText()).isEqualTo(stored.url());
        assertThat(info.get("size").asLong()).isEqualTo(5);
        assertThat(info.get("type").asText()).isEqualTo("text/plain");
        assertThat(info.get("name").asText()).isEqualTo("Report.TXT");
        assertThat(info.get("date").asLong()).isPositive();
    }

    @Test
    void extension_withoutUsableNameExtension_fallsBackToMimeType() {
        assertThat(store.extension("README", "text/plain")).isEqualTo("txt");
        assertThat(store.extension("weird.ex$t", null)).isEqualTo("bin");
    }

    @Test
    void put_unreadableStream_throwsStorageException() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk on fire");
            }
        };

        assertThatThrownBy(() -> store.put("x.txt", broken))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("x.txt");
    }

    @Test
    void resolve_mapsUrlBackToFile() {
        StoredContent stored = store.put("hello.txt", stream("hello"));

        assertThat(store.resolve(stored.url())).isEqualTo(root.toAbsolutePath().normalize().resolve(stored.relativePath()));
        assertThat(store.exists(stored.url())).isTrue();
    }

    @Test
    void resolve_rejectsForeignAndEscapingUrls() {
        assertThatThrownBy(() -> store.resolve("/static/x.txt")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.resolve("/~cache/../../etc/passwd")).isInstanceOf(IllegalArgumentException.class);
    }

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
