package com.sparrowwallet.pipit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Connection settings, stored as JSON.
 *
 * Default location: {@code <storage dir>/pipit.json}. A missing or unreadable file yields the defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipitConfig {
    private static final Logger log = LoggerFactory.getLogger(PipitConfig.class);

    public static final String CONFIG_FILE = "pipit.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    @JsonProperty("host")
    public String host = "127.0.0.1";

    @JsonProperty("port")
    public int port = 5555;

    @JsonProperty("connectTimeout")
    public int connectTimeout = 3000;

    @JsonProperty("readTimeout")
    public int readTimeout = 5000;

    /** Time allowed for the user to accept the debugging prompt on the device */
    @JsonProperty("trustTimeout")
    public int trustTimeout = 30000;

    @JsonProperty("drainTimeout")
    public int drainTimeout = 500;

    /** Number of frames read while waiting for a stream to be accepted */
    @JsonProperty("openAttempts")
    public int openAttempts = 10;

    /** Label appended to the public key, shown on the device when asking for trust */
    @JsonProperty("keyLabel")
    public String keyLabel = "pipit@" + getHostName();

    public static PipitConfig load(File storageDir) {
        return read(new File(storageDir, CONFIG_FILE));
    }

    public static PipitConfig read(File configFile) {
        try {
            if(!configFile.exists()) {
                return new PipitConfig();
            }

            String json = Files.readString(configFile.toPath(), StandardCharsets.UTF_8);
            return mapper.readValue(json, PipitConfig.class);
        } catch(Exception e) {
            if(log.isInfoEnabled()) {
                log.info("Could not read " + configFile.getAbsolutePath() + ", using defaults", e);
            }
            return new PipitConfig();
        }
    }

    public void write(File configFile) {
        try {
            if(!configFile.exists()) {
                configFile.getParentFile().mkdirs();
                configFile.createNewFile();
            }

            mapper.writerWithDefaultPrettyPrinter().writeValue(configFile, this);
        } catch(Exception e) {
            log.error("Could not write " + configFile.getAbsolutePath(), e);
        }
    }

    private static String getHostName() {
        try {
            return java.net.InetAddress.getLocalHost().getHostName();
        } catch(Exception e) {
            log.warn("Failed to get system hostname, using default", e);
            return "localhost";
        }
    }
}
