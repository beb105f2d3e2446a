package com.ciro.ncl.standalone;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("ncl.server.debounce-ms");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void defaultsComeFromReferenceConf() {
        PreviewServerConfig cfg = PreviewServerConfig.from(ConfigLoader.load(dir.resolve("missing.conf").toFile()));
        assertEquals(300, cfg.getDebounceMs());
        assertEquals(30, cfg.getSessionTtlMinutes());
        assertEquals(10_000, cfg.getMaxSessions());
    }

    @Test
    void fileOverridesDefaults() throws IOException {
        File file = dir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "ncl.server { port = 9191, max-sessions = 5 }", StandardCharsets.UTF_8);

        PreviewServerConfig cfg = PreviewServerConfig.from(ConfigLoader.load(file));
        assertEquals(9191, cfg.getPort());
        assertEquals(5, cfg.getMaxSessions());
        assertEquals(300, cfg.getDebounceMs());
    }

    @Test
    void systemPropertiesBeatTheFile() throws IOException {
        File file = dir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "ncl.server.debounce-ms = 500", StandardCharsets.UTF_8);
        System.setProperty("ncl.server.debounce-ms", "50");
        ConfigFactory.invalidateCaches();

        assertEquals(50, PreviewServerConfig.from(ConfigLoader.load(file)).getDebounceMs());
    }

    @Test
    void commandLineArgumentsBeatEverything() throws IOException {
        File file = dir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "ncl.server.port = 9191", StandardCharsets.UTF_8);
        System.setProperty("ncl.server.debounce-ms", "50");
        ConfigFactory.invalidateCaches();

        PreviewServerConfig cfg = PreviewServerConfig.from(ConfigLoader.load(file,
                new String[] {"--port=7070", "--ncl.server.debounce-ms=20", "stray"}));
        assertEquals(7070, cfg.getPort());
        assertEquals(20, cfg.getDebounceMs());
        assertEquals(10_000, cfg.getMaxSessions());
    }

    @Test
    void malformedArgumentsAreIgnored() {
        assertEquals(Map.of("ncl.server.port", "1"),
                ConfigLoader.argOverrides(new String[] {"--port=1", "-x=2", "--=3", "plain"}));
        assertTrue(ConfigLoader.argOverrides(null).isEmpty());
    }
}
