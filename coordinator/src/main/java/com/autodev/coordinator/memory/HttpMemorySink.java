package com.autodev.coordinator.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the semantic memory service.
 *
 * POSTs each record as JSON to {baseUrl}/memories; the service embeds the
 * content and indexes it. Called from worker threads after the ledger row
 * is committed, so blocking I/O here is acceptable.
 */
public class HttpMemorySink implements MemorySink {

    private static final Logger log = LoggerFactory.getLogger(HttpMemorySink.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public HttpMemorySink(String baseUrl, Duration timeout, ObjectMapper objectMapper) {
        this(baseUrl, timeout, objectMapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    HttpMemorySink(String baseUrl, Duration timeout, ObjectMapper objectMapper, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = http;
    }

    /**
     * @throws MemoryStoreException on a non-2xx response or I/O failure
     */
    @Override
    public void store(MemoryRecord record) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type",       record.type());
        body.put("tags",       record.tags());
        body.put("content",    record.content());
        body.put("importance", record.importance());
        body.put("timestamp",  record.timestamp().toString());
        post("/memories", toJson(body), "store " + record.type() + " memory");
        log.debug("Stored {} memory (importance={})", record.type(), record.importance());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new MemoryStoreException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (MemoryStoreException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemoryStoreException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new MemoryStoreException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new MemoryStoreException("JSON serialization failed", e);
        }
    }
}
