package com.xedledom;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void cleanup() {
        Config.reset();
    }

    @Test
    void missingLinkFileExitsWithLoadError() {
        int code = Main.run(new String[]{
                tempDir.resolve("missing.json").toString(),
                tempDir.resolve("models.json").toString(),
                tempDir.resolve("thumbs").toString()});

        assertEquals(Main.EXIT_LINKS_UNREADABLE, code);
    }

    @Test
    void emptyLinkFileWritesEmptyRegistry() throws Exception {
        Path links = tempDir.resolve("link.json");
        Files.writeString(links, "{}", StandardCharsets.UTF_8);
        Path registry = tempDir.resolve("out/models.json");

        int code = Main.run(new String[]{links.toString(), registry.toString()});

        assertEquals(Main.EXIT_OK, code);
        assertTrue(Files.exists(registry));
    }

    @Test
    void unwritableRegistryExitsWithPersistenceError() throws Exception {
        Path links = tempDir.resolve("link.json");
        Files.writeString(links, "{\"a\": \"not a url\"}", StandardCharsets.UTF_8);
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file");

        int code = Main.run(new String[]{links.toString(), blocker.resolve("models.json").toString()});

        assertEquals(Main.EXIT_REGISTRY_NOT_WRITTEN, code);
    }
}
