package com.autodev.coordinator.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Against a throwaway local HTTP server standing in for the memory service.
 */
class HttpMemorySinkTest {

    final ObjectMapper json = new ObjectMapper();
    final AtomicReference<String> lastBody = new AtomicReference<>();
    final AtomicReference<String> lastPath = new AtomicReference<>();
    final AtomicInteger status = new AtomicInteger(201);

    HttpServer server;
    HttpMemorySink sink;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] resp = "{}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), resp.length);
            exchange.getResponseBody().write(resp);
            exchange.close();
        });
        server.start();
        sink = new HttpMemorySink("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                Duration.ofSeconds(5), json);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void store_postsRecordAsJson() throws Exception {
        sink.store(new MemoryRecord("failure", List.of("implement_feature", "w1", "outcome"),
                "Task implement_feature failure: compile error", 7, Instant.parse("2026-03-01T12:00:00Z")));

        assertThat(lastPath.get()).isEqualTo("/memories");
        JsonNode body = json.readTree(lastBody.get());
        assertThat(body.get("type").asText()).isEqualTo("failure");
        assertThat(body.get("importance").asInt()).isEqualTo(7);
        assertThat(body.get("tags")).hasSize(3);
        assertThat(body.get("timestamp").asText()).isEqualTo("2026-03-01T12:00:00Z");
    }

    @Test
    void store_serverError_throwsMemoryStoreException() {
        status.set(500);

        assertThatThrownBy(() -> sink.store(new MemoryRecord("lesson", List.of(), "x", 5, Instant.now())))
                .isInstanceOf(MemoryStoreException.class)
                .hasMessageContaining("HTTP 500");
    }
}
