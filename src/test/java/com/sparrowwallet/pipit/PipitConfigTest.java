package com.sparrowwallet.pipit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

public class PipitConfigTest {
    @TempDir
    File storageDir;

    @Test
    public void testDefaults() {
        PipitConfig config = PipitConfig.load(storageDir);

        assertEquals("127.0.0.1", config.host);
        assertEquals(5555, config.port);
        assertEquals(3000, config.connectTimeout);
        assertEquals(5000, config.readTimeout);
        assertEquals(30000, config.trustTimeout);
        assertEquals(500, config.drainTimeout);
        assertEquals(10, config.openAttempts);
        assertTrue(config.keyLabel.startsWith("pipit@"));
    }

    @Test
    public void testLoadIgnoresUnknownProperties() throws IOException {
        String json = "{\"port\": 5037, \"readTimeout\": 1500, \"keyLabel\": \"kiosk\", \"theme\": \"dark\"}";
        Files.writeString(new File(storageDir, PipitConfig.CONFIG_FILE).toPath(), json, StandardCharsets.UTF_8);

        PipitConfig config = PipitConfig.load(storageDir);
        assertEquals(5037, config.port);
        assertEquals(1500, config.readTimeout);
        assertEquals("kiosk", config.keyLabel);
        assertEquals("127.0.0.1", config.host);
        assertEquals(30000, config.trustTimeout);
    }

    @Test
    public void testInvalidFileUsesDefaults() throws IOException {
        Files.writeString(new File(storageDir, PipitConfig.CONFIG_FILE).toPath(), "{ not json", StandardCharsets.UTF_8);

        PipitConfig config = PipitConfig.load(storageDir);
        assertEquals(5555, config.port);
    }

    @Test
    public void testWriteThenRead() {
        PipitConfig config = new PipitConfig();
        config.host = "10.0.0.7";
        config.port = 5556;
        config.drainTimeout = 250;

        File configFile = new File(storageDir, "nested/" + PipitConfig.CONFIG_FILE);
        config.write(configFile);
        assertTrue(configFile.exists());

        PipitConfig read = PipitConfig.read(configFile);
        assertEquals("10.0.0.7", read.host);
        assertEquals(5556, read.port);
        assertEquals(250, read.drainTimeout);
        assertEquals(config.keyLabel, read.keyLabel);
    }
}
