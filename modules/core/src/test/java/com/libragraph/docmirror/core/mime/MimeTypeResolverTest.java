package com.libragraph.docmirror.core.mime;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MimeTypeResolverTest {

    MimeTypeResolver resolver = new MimeTypeResolver(
            MimeTypeResolver.parseOverrides("mdx:text/markdown,l:text/markdown"));

    @Test
    void parseOverrides_skipsMalformedEntries() {
        Map<String, String> parsed = MimeTypeResolver.parseOverrides(" .MDX:text/markdown , broken, :x/y, ss:text/markdown");

        assertThat(parsed).containsExactly(
                Map.entry("mdx", "text/markdown"),
                Map.entry("ss", "text/markdown"));
    }

    @Test
    void uploadMimeType_overrideWinsOverDetection() {
        assertThat(resolver.uploadMimeType("lesson.l")).contains("text/markdown");
        assertThat(resolver.uploadMimeType("docs/Page.MDX")).contains("text/markdown");
    }

    @Test
    void uploadMimeType_jsonIsOmitted() {
        assertThat(resolver.detect("data.json")).isEqualTo("application/json");
        assertThat(resolver.uploadMimeType("data.json")).isEmpty();
    }

    @Test
    void uploadMimeType_unknownIsOmitted() {
        assertThat(resolver.uploadMimeType("no-extension")).isEmpty();
    }

    @Test
    void uploadMimeType_detectedTypeOtherwise() {
        assertThat(resolver.uploadMimeType("paper.pdf")).contains("application/pdf");
    }

    @Test
    void extensionOf_lastSegmentOnly() {
        assertThat(MimeTypeResolver.extensionOf("dir.v2/file")).isNull();
        assertThat(MimeTypeResolver.extensionOf("archive.tar.GZ")).isEqualTo("gz");
        assertThat(MimeTypeResolver.extensionOf(".hidden")).isNull();
        assertThat(MimeTypeResolver.extensionOf("trailing.")).isNull();
    }

    @Test
    void extensionFor_knownType() {
        assertThat(resolver.extensionFor("application/pdf")).isEqualTo("pdf");
        assertThat(resolver.extensionFor("not a type")).isNull();
    }
}
