package com.xedledom.civitai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.xedledom.civitai.model.ModelRecord;
import com.xedledom.civitai.model.RecordMetadata;
import com.xedledom.fetch.FetchPolicy;
import com.xedledom.fetch.HostThrottle;
import com.xedledom.fetch.HttpFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ModelResolverTest {

    private static final String PAGE = """
            <html><head>
            <meta property="og:image" content="https://image.civitai.com/preview.jpeg">
            </head><body>
            <h1>Neon Glow</h1>
            <table>
            <tr><td><p>Type</p></td><td><p>LORA</p></td></tr>
            <tr><td><p>Base Model</p></td><td><p>Pony</p></td></tr>
            </table>
            </body></html>
            """;

    private HttpServer server;
    private String baseUrl;
    private HttpFetcher fetcher;
    private final AtomicInteger pageHits = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/models/42", ex -> {
            pageHits.incrementAndGet();
            respond(ex, 200, PAGE);
        });
        server.createContext("/models/43", ex -> respond(ex, 200, "<html><body><p>Nothing here</p></body></html>"));
        server.createContext("/gone", ex -> respond(ex, 404, "gone"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        fetcher = new HttpFetcher(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
                "ModelDex/Test",
                new HostThrottle(Duration.ZERO, Duration.ZERO),
                new FetchPolicy(1, Duration.ZERO, Duration.ZERO),
                d -> { }
        );
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void apiResultIsUsedWithoutTouchingThePage() throws Exception {
        ModelRecord fromApi = new ModelRecord("a", "From API", "lora", "v1", "", "", "", "", "", List.of(), List.of(),
                "https://civitai.com/models/42", RecordMetadata.EMPTY);
        ModelResolver resolver = resolver((name, url) -> fromApi, true);

        assertSame(fromApi, resolver.resolve("a", baseUrl + "/models/42/neon"));
        assertEquals(0, pageHits.get());
    }

    @Test
    void fallsBackToPageWhenApiFails() throws Exception {
        ModelResolver resolver = resolver(failingApi(), true);
        String url = baseUrl + "/models/42/neon";

        ModelRecord record = resolver.resolve("neon.safetensors", url);

        assertEquals("neon.safetensors", record.filename());
        assertEquals("Neon Glow", record.title());
        assertEquals("lora", record.type());
        assertEquals("Pony", record.baseModel());
        assertEquals("https://civitai.com/models/42", record.modelLink());
        assertEquals("https://image.civitai.com/preview.jpeg", record.thumbnail());
        assertEquals(List.of("https://image.civitai.com/preview.jpeg"), record.thumbnailsAll());
        assertEquals(url, record.metadata().downloadLink());
        assertTrue(record.metadata().hashes().isEmpty());
    }

    @Test
    void disabledFallbackRethrowsApiError() {
        ModelResolver resolver = resolver(failingApi(), false);

        ResolutionException e = assertThrows(ResolutionException.class,
                () -> resolver.resolve("neon", baseUrl + "/models/42/neon"));

        assertEquals("api down", e.getMessage());
        assertEquals(0, pageHits.get());
    }

    @Test
    void pageWithoutTitleCountsAsFailure() {
        ModelResolver resolver = resolver(failingApi(), true);

        ResolutionException e = assertThrows(ResolutionException.class,
                () -> resolver.resolve("x", baseUrl + "/models/43/empty"));

        assertEquals("api down", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
    }

    @Test
    void unreachablePageKeepsApiErrorAndAttachesPageError() {
        ModelResolver resolver = resolver(failingApi(), true);

        ResolutionException e = assertThrows(ResolutionException.class,
                () -> resolver.resolve("x", baseUrl + "/gone"));

        assertEquals("api down", e.getMessage());
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("Page request failed"));
    }

    @Test
    void linkWithoutModelIdKeepsInputUrl() {
        ModelResolver resolver = resolver(failingApi(), true);
        String url = "https://civitai.com/user/someone";

        ModelRecord record = resolver.toRecord("x", url,
                new CivitaiPageParser(new ObjectMapper()).parse(url, "<h1>Someone</h1>"));

        assertEquals(url, record.modelLink());
        assertEquals("Someone", record.title());
        assertTrue(record.thumbnailsAll().isEmpty());
        assertEquals(url, record.metadata().downloadLink());
    }

    private ModelResolver resolver(MetadataResolver api, boolean fallback) {
        return new ModelResolver(api, fetcher, new CivitaiPageParser(new ObjectMapper()),
                "https://civitai.com", Duration.ofSeconds(5), fallback);
    }

    private static MetadataResolver failingApi() {
        return (name, url) -> {
            throw new ResolutionException("api down");
        };
    }

    private static void respond(com.sun.net.httpserver.HttpExchange ex, int code, String body) throws java.io.IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(code, bytes.length);
        try (var os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
