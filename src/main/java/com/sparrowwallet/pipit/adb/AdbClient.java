package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceException;
import com.sparrowwallet.pipit.PipitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single persistent connection to the daemon.
 *
 * All socket use happens while holding one lock, so concurrent callers queue behind each other
 * rather than opening parallel connections. A command that fails on an existing connection is retried
 * exactly once on a freshly authenticated connection.
 */
public class AdbClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdbClient.class);

    private final Object lock = new Object();

    private final PipitConfig config;
    private final AdbKeyPair keyPair;
    private final StreamMultiplexer multiplexer;
    private AdbConnection connection;
    private int connectionCount;

    public AdbClient(PipitConfig config, AdbKeyPair keyPair) {
        this.config = config;
        this.keyPair = keyPair;
        this.multiplexer = new StreamMultiplexer(config.openAttempts, config.drainTimeout);
    }

    /**
     * Connect and authenticate if there is no open connection.
     *
     * @throws DeviceException if the connection cannot be established
     */
    public void connect() throws DeviceException {
        synchronized(lock) {
            ensureConnected();
        }
    }

    /**
     * Run a shell command.
     *
     * @param command The shell command line
     * @return true if the daemon accepted the command, false if it refused it on a fresh connection
     * @throws DeviceException if a fresh connection could not be established or failed during the command
     */
    public boolean execute(String command) throws DeviceException {
        synchronized(lock) {
            if(connection != null && connection.isOpen()) {
                try {
                    if(runOnce(command)) {
                        return true;
                    }
                } catch(DeviceException e) {
                    log.debug("Command failed on existing connection: {}", e.getMessage());
                }

                log.debug("Reconnecting");
                closeConnection();
            }

            try {
                ensureConnected();
                if(runOnce(command)) {
                    return true;
                }
            } catch(DeviceException e) {
                closeConnection();
                throw e;
            }

            closeConnection();
            return false;
        }
    }

    public boolean isConnected() {
        synchronized(lock) {
            return connection != null && connection.isOpen();
        }
    }

    /**
     * @return the number of connections authenticated so far
     */
    public int getConnectionCount() {
        synchronized(lock) {
            return connectionCount;
        }
    }

    @Override
    public void close() {
        synchronized(lock) {
            closeConnection();
        }
    }

    private boolean runOnce(String command) throws DeviceException {
        return multiplexer.runCommand(connection, connection.allocateLocalId(), command);
    }

    private void ensureConnected() throws DeviceException {
        if(connection != null && connection.isOpen()) {
            return;
        }

        closeConnection();
        Transport transport = new SocketTransport(config.host, config.port, config.connectTimeout, config.readTimeout);
        connection = AdbConnection.handshake(transport, keyPair, config.trustTimeout);
        connectionCount++;
    }

    private void closeConnection() {
        if(connection != null) {
            connection.close();
            connection = null;
        }
    }
}
