package com.libragraph.docmirror.core.remote.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.docmirror.core.config.GeminiConfig;
import com.libragraph.docmirror.core.remote.CustomMetadata;
import com.libragraph.docmirror.core.remote.RemoteClient;
import com.libragraph.docmirror.core.remote.RemoteDocument;
import com.libragraph.docmirror.core.remote.RemoteException;
import com.libragraph.docmirror.core.remote.RemoteNotFoundException;
import com.libragraph.docmirror.core.remote.RemoteOperation;
import com.libragraph.docmirror.core.remote.RemoteStore;
import com.libragraph.docmirror.core.remote.UploadRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link RemoteClient} over the Gemini File Search REST API.
 *
 * <p>Uploads use the {@code multipart/related} upload protocol: a JSON metadata part followed by
 * the file bytes, streamed from disk.
 */
@ApplicationScoped
public class GeminiFileSearchClient implements RemoteClient {

    private static final Logger log = Logger.getLogger(GeminiFileSearchClient.class);

    static final String API_KEY_HEADER = "x-goog-api-key";
    private static final String JSON = "application/json";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private String baseUrl;
    private String apiKey;
    private Duration requestTimeout;
    private int pageSize;
    private ObjectMapper objectMapper;
    private HttpClient httpClient;

    @Inject
    public GeminiFileSearchClient(GeminiConfig config, ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(config.baseUrl());
        this.apiKey = config.apiKey();
        this.requestTimeout = config.requestTimeout();
        this.pageSize = config.pageSize();
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
    }

    @Override
    public RemoteStore createStore(String displayName) {
        ObjectNode body = objectMapper.createObjectNode().put("displayName", displayName);
        JsonNode json = send(request("v1beta/fileSearchStores")
                .header("Content-Type", JSON)
                .POST(HttpRequest.BodyPublishers.ofString(write(body))), "create store " + displayName);
        RemoteStore store = read(json, RemoteStore.class);
        log.infof("Created remote store %s (%s)", store.name(), displayName);
        return store;
    }

    @Override
    public RemoteStore getStore(String storeName) {
        return read(send(request("v1beta/" + storeName).GET(), "get store " + storeName), RemoteStore.class);
    }

    @Override
    public void deleteStore(String storeName, boolean force) {
        send(request("v1beta/" + storeName + (force ? "?force=true" : "")).DELETE(), "delete store " + storeName);
        log.infof("Deleted remote store %s", storeName);
    }

    @Override
    public List<RemoteDocument> listDocuments(String storeName) {
        List<RemoteDocument> documents = new ArrayList<>();
        String pageToken = null;
        do {
            String path = "v1beta/" + storeName + "/documents?pageSize=" + pageSize;
            if (pageToken != null) {
                path += "&pageToken=" + URLEncoder.encode(pageToken, StandardCharsets.UTF_8);
            }
            JsonNode page = send(request(path).GET(), "list documents of " + storeName);
            for (JsonNode doc : page.path("documents")) {
                documents.add(read(doc, RemoteDocument.class));
            }
            pageToken = page.hasNonNull("nextPageToken") && !page.get("nextPageToken").asText().isEmpty()
                    ? page.get("nextPageToken").asText()
                    : null;
        } while (pageToken != null);
        log.debugf("Listed %d documents in %s", documents.size(), storeName);
        return documents;
    }

    @Override
    public RemoteDocument getDocument(String documentName) {
        return read(send(request("v1beta/" + documentName).GET(), "get document " + documentName),
                RemoteDocument.class);
    }

    @Override
    public RemoteOperation upload(String storeName, UploadRequest upload) {
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("displayName", upload.displayName());
        if (upload.mimeType() != null) {
            metadata.put("mimeType", upload.mimeType());
        }
        ArrayNode custom = metadata.putArray("customMetadata");
        for (CustomMetadata m : upload.customMetadata()) {
            custom.add(objectMapper.valueToTree(m));
        }

        String boundary = "docmirror-" + UUID.randomUUID();
        String head = "--" + boundary + "\r\n"
                + "Content-Type: application/json; charset=UTF-8\r\n\r\n"
                + write(metadata) + "\r\n"
                + "--" + boundary + "\r\n"
                + "Content-Type: " + (upload.mimeType() != null ? upload.mimeType() : "application/octet-stream")
                + "\r\n\r\n";
        String tail = "\r\n--" + boundary + "--\r\n";

        HttpRequest.BodyPublisher body;
        try {
            body = HttpRequest.BodyPublishers.concat(
                    HttpRequest.BodyPublishers.ofString(head, StandardCharsets.UTF_8),
                    HttpRequest.BodyPublishers.ofFile(upload.file()),
                    HttpRequest.BodyPublishers.ofString(tail, StandardCharsets.UTF_8));
        } catch (FileNotFoundException e) {
            throw new RemoteException("Upload source missing: " + upload.file(), e);
        }

        JsonNode json = send(request("upload/v1beta/" + storeName + ":uploadToFileSearchStore?uploadType=multipart")
                .header("Content-Type", "multipart/related; boundary=" + boundary)
                .header("X-Goog-Upload-Protocol", "multipart")
                .POST(body), "upload " + upload.displayName());
        RemoteOperation operation = operation(json);
        log.debugf("Upload of %s started as %s", upload.displayName(), operation.name());
        return operation;
    }

    @Override
    public RemoteOperation getOperation(String operationName) {
        return operation(send(request("v1beta/" + operationName).GET(), "get operation " + operationName));
    }

    @Override
    public void deleteDocument(String documentName) {
        try {
            send(request("v1beta/" + documentName + "?force=true").DELETE(), "delete document " + documentName);
            log.debugf("Deleted remote document %s", documentName);
        } catch (RemoteNotFoundException e) {
            log.debugf("Remote document %s already gone", documentName);
        }
    }

    RemoteOperation operation(JsonNode json) {
        String error = null;
        if (json.hasNonNull("error")) {
            JsonNode e = json.get("error");
            error = e.path("message").asText(e.toString());
        }
        String documentName = json.path("response").hasNonNull("documentName")
                ? json.path("response").get("documentName").asText()
                : null;
        return new RemoteOperation(json.path("name").asText(null), json.path("done").asBoolean(false),
                documentName, error);
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + path))
                .timeout(requestTimeout)
                .header(API_KEY_HEADER, apiKey);
    }

    private JsonNode send(HttpRequest.Builder builder, String action) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteException("Failed to " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteException("Interrupted during " + action, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            throw new RemoteNotFoundException("Not found: " + action + ": " + errorMessage(response.body()));
        }
        if (status < 200 || status >= 300) {
            throw new RemoteException(status, "Failed to " + action + " (HTTP " + status + "): "
                    + errorMessage(response.body()));
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteException("Unreadable response to " + action, e);
        }
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) return "(empty response)";
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private <T> T read(JsonNode json, Class<T> type) {
        try {
            return objectMapper.treeToValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RemoteException("Unreadable " + type.getSimpleName() + " in response", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
