package com.libragraph.docmirror.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Settings under {@code gemini.*} for the File Search REST API.
 */
@ConfigMapping(prefix = "gemini")
public interface GeminiConfig {

    String apiKey();

    @WithDefault("https://generativelanguage.googleapis.com")
    String baseUrl();

    @WithDefault("PT60S")
    Duration requestTimeout();

    /** Page size for document listings (the API caps it at 20). */
    @WithDefault("20")
    int pageSize();
}
