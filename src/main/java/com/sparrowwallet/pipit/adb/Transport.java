package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceException;

/**
 * Message transport to the daemon.
 * Handles framing and raw I/O without protocol-specific logic.
 */
public interface Transport extends AutoCloseable {

    /**
     * Write a message to the daemon.
     *
     * @param message The message to write
     * @throws DeviceException if write fails
     */
    void write(AdbMessage message) throws DeviceException;

    /**
     * Read a message with the default timeout.
     *
     * @return The message read
     * @throws DeviceException if read fails, times out or the connection is closed
     */
    AdbMessage read() throws DeviceException;

    /**
     * Read a message, waiting at most the given time for it to start arriving.
     *
     * @param timeoutMs Timeout in milliseconds
     * @return The message read
     * @throws DeviceException if read fails, times out or the connection is closed
     */
    AdbMessage read(int timeoutMs) throws DeviceException;

    /**
     * Close the transport and release resources.
     * Should be idempotent (safe to call multiple times).
     */
    @Override
    void close();

    /**
     * @return true if the transport has been closed or the underlying connection is known to be gone
     */
    boolean isClosed();
}
