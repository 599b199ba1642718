package com.sparrowwallet.pipit;

import com.sparrowwallet.pipit.adb.AdbClient;
import com.sparrowwallet.pipit.adb.AdbKeyPair;
import com.sparrowwallet.pipit.adb.AdbKeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The main interface to the library.
 *
 * Sends shell commands and key events to the debug daemon on this device. Failures never propagate:
 * every operation reports success as a boolean and logs the reason for a failure, so automation
 * callers can skip a step and carry on.
 */
public class Pipit implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Pipit.class);

    private final File storageDir;
    private final PipitConfig config;
    private final ExecutorService preconnectExecutor;
    private volatile AdbKeyPair keyPair;
    private volatile AdbClient adbClient;

    /**
     * Create an instance storing keys and reading {@code pipit.json} in the given directory.
     *
     * @param storageDir application private directory
     */
    public Pipit(File storageDir) {
        this(storageDir, PipitConfig.load(storageDir));
    }

    public Pipit(File storageDir, PipitConfig config) {
        this.storageDir = storageDir;
        this.config = config;
        this.preconnectExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "pipit-preconnect");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Loads or generates the host key pair and starts connecting in the background.
     * A failed background connection is not an error, the first command will connect again.
     *
     * @return whether the key pair is available
     */
    public synchronized boolean init() {
        if(adbClient != null) {
            return true;
        }

        try {
            AdbKeyStore keyStore = new AdbKeyStore(storageDir, config.keyLabel);
            keyPair = keyStore.loadOrGenerate();
        } catch(DeviceException e) {
            log.error("Failed to initialise keys in " + storageDir.getAbsolutePath(), e);
            return false;
        }

        AdbClient client = new AdbClient(config, keyPair);
        adbClient = client;

        if(!preconnectExecutor.isShutdown()) {
            preconnectExecutor.execute(() -> preconnect(client));
        }

        return true;
    }

    /**
     * Sends a key event, equivalent to {@code input keyevent <code>}.
     *
     * @param keyCode the Android key code
     * @return whether the daemon accepted the command
     */
    public boolean sendKeyEvent(int keyCode) {
        return sendShellCommand("input keyevent " + keyCode);
    }

    public boolean sendKeyEvent(KeyCode keyCode) {
        return sendKeyEvent(keyCode.getCode());
    }

    /**
     * Runs a shell command on the device. The connection is reused across calls, and re-established
     * once if it has gone stale.
     *
     * @param command the shell command line
     * @return whether the daemon accepted the command
     */
    public boolean sendShellCommand(String command) {
        AdbClient client = adbClient;
        if(client == null) {
            log.warn("Cannot send command", new DeviceInitializationException("Keys not initialised, call init() first"));
            return false;
        }

        if(command == null || command.isBlank()) {
            log.warn("Ignoring empty shell command");
            return false;
        }

        try {
            boolean accepted = client.execute(command);
            if(!accepted) {
                log.warn("Shell command was not accepted: " + command);
            }
            return accepted;
        } catch(DeviceException e) {
            log.warn("Shell command failed (" + command + "): " + e.getMessage());
            if(log.isDebugEnabled()) {
                log.debug("Shell command failure", e);
            }
        } catch(RuntimeException e) {
            log.error("Shell command failed (" + command + ")", e);
        }

        return false;
    }

    public boolean isInitialized() {
        return adbClient != null;
    }

    public boolean isConnected() {
        AdbClient client = adbClient;
        return client != null && client.isConnected();
    }

    @Override
    public void close() {
        preconnectExecutor.shutdownNow();
        try {
            if(!preconnectExecutor.awaitTermination(config.connectTimeout, TimeUnit.MILLISECONDS)) {
                log.debug("Pre-connection still running at close");
            }
        } catch(InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        AdbClient client = adbClient;
        if(client != null) {
            client.close();
        }
    }

    void preconnect(AdbClient client) {
        try {
            client.connect();
            log.info("Pre-connection established");
        } catch(DeviceException e) {
            log.debug("Pre-connection failed, will retry on first command: {}", e.getMessage());
        } catch(RuntimeException e) {
            log.error("Pre-connection failed", e);
        }
    }

    AdbClient getAdbClient() {
        return adbClient;
    }
}
