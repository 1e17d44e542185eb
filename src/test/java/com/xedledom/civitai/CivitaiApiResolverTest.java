package com.xedledom.civitai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.xedledom.civitai.model.ModelRecord;
import com.xedledom.fetch.FetchPolicy;
import com.xedledom.fetch.HostThrottle;
import com.xedledom.fetch.HttpFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CivitaiApiResolverTest {

    private static final String WEB_BASE = "https://civitai.com";

    private HttpServer server;
    private CivitaiApiResolver resolver;
    private final AtomicInteger modelHits = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/v1/models", ex -> {
            modelHits.incrementAndGet();
            String path = ex.getRequestURI().getPath();
            if (path.equals("/api/v1/models/42")) {
                Json.respond(ex, 200, """
                        { "id": 42, "name": "Neon Glow", "modelVersions": [ { "id": 100 }, { "id": 99 } ] }
                        """);
            } else if (path.equals("/api/v1/models/7")) {
                Json.respond(ex, 200, "{\"id\":7,\"modelVersions\":[]}");
            } else {
                Json.respond(ex, 404, "{}");
            }
        });
        server.createContext("/api/v1/model-versions", ex -> {
            String path = ex.getRequestURI().getPath();
            if (path.equals("/api/v1/model-versions/100")) {
                Json.respond(ex, 200, """
                        {
                          "id": 100,
                          "name": "v1.0",
                          "baseModel": "SDXL 1.0",
                          "baseModelType": "Standard",
                          "createdAt": "2024-01-02T03:04:05.000Z",
                          "description": "<p>Sharper edges</p>",
                          "trainedWords": ["neon", "glow"],
                          "model": { "id": 42, "name": "Neon Glow", "type": "LORA" },
                          "files": [
                            {
                              "sizeKB": 2048,
                              "downloadUrl": "https://civitai.com/api/download/models/100",
                              "hashes": { "SHA256": "ABC123", "AutoV2": "DEF" }
                            }
                          ],
                          "images": [
                            { "url": "https://image.civitai.com/1.jpeg" },
                            { "url": "https://image.civitai.com/2.jpeg" },
                            { "url": "https://image.civitai.com/3.jpeg" },
                            { "url": "https://image.civitai.com/4.jpeg" },
                            { "url": "https://image.civitai.com/5.jpeg" },
                            { "url": "https://image.civitai.com/6.jpeg" }
                          ]
                        }
                        """);
            } else if (path.equals("/api/v1/model-versions/99")) {
                Json.respond(ex, 200, """
                        { "id": 99, "name": "v0.9", "model": { "type": "Checkpoint" }, "files": [], "images": [] }
                        """);
            } else if (path.equals("/api/v1/model-versions/98")) {
                Json.respond(ex, 200, "not json at all");
            } else {
                Json.respond(ex, 404, "{}");
            }
        });
        server.start();
        String apiBase = "http://127.0.0.1:" + server.getAddress().getPort() + "/api/v1/";

        HttpFetcher fetcher = new HttpFetcher(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
                "ModelDex/Test",
                new HostThrottle(Duration.ZERO, Duration.ZERO),
                new FetchPolicy(1, Duration.ZERO, Duration.ZERO),
                d -> { }
        );
        resolver = new CivitaiApiResolver(fetcher, new ObjectMapper(), apiBase, WEB_BASE, Duration.ofSeconds(5), 5);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void resolvesLatestVersionWhenUrlHasNone() throws Exception {
        ModelRecord record = resolver.resolve("neon.safetensors", "https://civitai.com/models/42/neon-glow");

        assertEquals("neon.safetensors", record.filename());
        assertEquals("Neon Glow - v1.0", record.title());
        assertEquals("lora", record.type());
        assertEquals("v1.0", record.version());
        assertEquals("SDXL 1.0", record.baseModel());
        assertEquals("Standard", record.baseModelType());
        assertEquals("2 MB", record.size());
        assertEquals("https://civitai.com/models/42", record.modelLink());
        assertEquals("https://image.civitai.com/1.jpeg", record.thumbnail());
        assertEquals(5, record.thumbnailsAll().size());
        assertTrue(record.thumbnailsLocal().isEmpty());

        assertEquals("neon, glow", record.metadata().trainedWords());
        assertEquals(Map.of("SHA256", "ABC123", "AutoV2", "DEF"), record.metadata().hashes());
        assertEquals(List.of("SHA256", "AutoV2"), List.copyOf(record.metadata().hashes().keySet()));
        assertEquals("<p>Sharper edges</p>", record.metadata().description());
        assertEquals("https://civitai.com/api/download/models/100", record.metadata().downloadLink());
        assertEquals("2024-01-02", record.metadata().publishedOn());
    }

    @Test
    void explicitVersionSkipsModelLookup() throws Exception {
        String url = "https://civitai.com/models/42/neon-glow?modelVersionId=99";

        ModelRecord record = resolver.resolve("old.safetensors", url);

        assertEquals(0, modelHits.get());
        assertEquals("v0.9", record.title());
        assertEquals("checkpoint", record.type());
        assertEquals("", record.size());
        assertEquals("", record.thumbnail());
        assertEquals(url, record.metadata().downloadLink());
        assertEquals("https://civitai.com/models/42", record.modelLink());
    }

    @Test
    void urlWithoutModelIdFails() {
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> resolver.resolve("x", "https://civitai.com/user/someone"));
        assertTrue(e.getMessage().contains("No model ID"));
    }

    @Test
    void modelWithoutVersionsFails() {
        assertThrows(ResolutionException.class, () -> resolver.resolve("x", "https://civitai.com/models/7"));
    }

    @Test
    void missingVersionFails() {
        assertThrows(ResolutionException.class,
                () -> resolver.resolve("x", "https://civitai.com/models/42?modelVersionId=12345"));
    }

    @Test
    void invalidJsonFails() {
        assertThrows(ResolutionException.class,
                () -> resolver.resolve("x", "https://civitai.com/models/42?modelVersionId=98"));
    }

    private static final class Json {
        private static void respond(com.sun.net.httpserver.HttpExchange ex, int code, String body) throws java.io.IOException {
            byte[] bytes = body.getBytes(java.nio.charset.StandardCharsets.UTF_8);
            ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            ex.sendResponseHeaders(code, bytes.length);
            try (var os = ex.getResponseBody()) {
                os.write(bytes);
            }
        }
    }
}
