package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceException;
import com.sparrowwallet.pipit.DeviceTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Runs one shell stream at a time over a shared connection.
 *
 * Frames from earlier streams can still arrive after their command has returned. They are acknowledged
 * and skipped rather than mistaken for the current stream's response:
 * WRTE for another stream is answered with OKAY, CLSE for another stream with CLSE.
 */
public class StreamMultiplexer {
    private static final Logger log = LoggerFactory.getLogger(StreamMultiplexer.class);

    public static final String SHELL_PREFIX = "shell:";

    /** Upper bound on frames read while draining a command's output */
    private static final int MAX_DRAIN_FRAMES = 1024;

    private final int openAttempts;
    private final int drainTimeoutMs;

    public StreamMultiplexer(int openAttempts, int drainTimeoutMs) {
        this.openAttempts = openAttempts;
        this.drainTimeoutMs = drainTimeoutMs;
    }

    /**
     * Open a shell stream for the command, wait for the daemon to accept it, then drain and close the stream.
     *
     * @param connection The connection to use
     * @param localId Our id for the new stream
     * @param command The shell command line
     * @return true if the daemon accepted the stream, false if it refused or never answered with OKAY
     * @throws DeviceException if the connection fails
     * @throws IllegalArgumentException if the command does not fit in one payload
     */
    public boolean runCommand(AdbConnection connection, int localId, String command) throws DeviceException {
        AdbMessage open = AdbMessage.open(localId, SHELL_PREFIX + command);
        if(open.getPayload().length > connection.getMaxPayload()) {
            throw new IllegalArgumentException("Command of " + open.getPayload().length + " bytes exceeds maximum payload of " + connection.getMaxPayload());
        }

        Transport transport = connection.getTransport();
        transport.write(open);

        Integer remoteId = awaitOkay(transport, localId);
        if(remoteId == null) {
            return false;
        }

        log.debug("Shell command accepted on stream {}/{}: {}", localId, remoteId, command);
        drainOutput(transport, localId, remoteId);
        return true;
    }

    private Integer awaitOkay(Transport transport, int localId) throws DeviceException {
        for(int attempt = 0; attempt < openAttempts; attempt++) {
            AdbMessage message = transport.read();

            if(message.is(AdbCommand.OKAY) && message.getArg1() == localId) {
                return message.getArg0();
            }

            if(message.is(AdbCommand.CLSE) && message.getArg1() == localId) {
                log.warn("Daemon refused to open stream " + localId);
                return null;
            }

            if(drainStray(transport, message)) {
                continue;
            }

            log.warn("Unexpected message while waiting for OKAY on stream " + localId + ": " + message);
            return null;
        }

        log.warn("No OKAY for stream " + localId + " after " + openAttempts + " messages");
        return null;
    }

    private void drainOutput(Transport transport, int localId, int remoteId) throws DeviceException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        for(int i = 0; i < MAX_DRAIN_FRAMES; i++) {
            AdbMessage message;
            try {
                message = transport.read(drainTimeoutMs);
            } catch(DeviceTimeoutException e) {
                transport.write(AdbMessage.close(localId, remoteId));
                logOutput(localId, output);
                return;
            }

            if(isForStream(message, localId, remoteId)) {
                if(message.is(AdbCommand.WRTE)) {
                    output.writeBytes(message.getPayload());
                    transport.write(AdbMessage.okay(localId, remoteId));
                    continue;
                }
                if(message.is(AdbCommand.CLSE)) {
                    transport.write(AdbMessage.close(localId, remoteId));
                    logOutput(localId, output);
                    return;
                }
            }

            if(drainStray(transport, message) || message.is(AdbCommand.OKAY)) {
                continue;
            }

            log.warn("Unexpected message while draining stream " + localId + ": " + message);
            return;
        }

        transport.write(AdbMessage.close(localId, remoteId));
        logOutput(localId, output);
    }

    /**
     * Acknowledge a frame that belongs to some other stream.
     *
     * @return true if the frame was a stray WRTE or CLSE and has been acknowledged
     */
    private static boolean drainStray(Transport transport, AdbMessage message) throws DeviceException {
        if(message.is(AdbCommand.WRTE)) {
            transport.write(AdbMessage.okay(message.getArg1(), message.getArg0()));
            log.debug("Drained stray WRTE for stream {}", message.getArg1());
            return true;
        }

        if(message.is(AdbCommand.CLSE)) {
            transport.write(AdbMessage.close(message.getArg1(), message.getArg0()));
            log.debug("Drained stray CLSE for stream {}", message.getArg1());
            return true;
        }

        return false;
    }

    private static boolean isForStream(AdbMessage message, int localId, int remoteId) {
        return message.getArg0() == remoteId && message.getArg1() == localId;
    }

    private static void logOutput(int localId, ByteArrayOutputStream output) {
        if(log.isDebugEnabled() && output.size() > 0) {
            log.debug("Stream {} output: {}", localId, output.toString(StandardCharsets.UTF_8).trim());
        }
    }
}
