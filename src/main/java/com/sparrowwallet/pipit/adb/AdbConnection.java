package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An authenticated connection to the daemon.
 *
 * Local stream ids start at 1 and are never reused while the connection is alive.
 */
public class AdbConnection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdbConnection.class);

    private final Transport transport;
    private final int protocolVersion;
    private final int maxPayload;
    private final String banner;
    private int nextLocalId = 1;

    public AdbConnection(Transport transport, HandshakeStateMachine.Result handshakeResult) {
        this.transport = transport;
        this.protocolVersion = handshakeResult.protocolVersion;
        this.maxPayload = handshakeResult.maxPayload;
        this.banner = handshakeResult.banner;
    }

    /**
     * Open a transport and authenticate over it.
     *
     * @param transport Newly connected transport, closed here if the handshake fails
     * @param keyPair Host key pair
     * @param trustTimeoutMs How long to wait for the user to accept an unknown key
     * @return The authenticated connection
     * @throws DeviceException if the handshake fails
     */
    public static AdbConnection handshake(Transport transport, AdbKeyPair keyPair, int trustTimeoutMs) throws DeviceException {
        try {
            HandshakeStateMachine handshake = new HandshakeStateMachine(transport, keyPair, trustTimeoutMs);
            return new AdbConnection(transport, handshake.executeHandshake());
        } catch(DeviceException e) {
            transport.close();
            throw e;
        }
    }

    public Transport getTransport() {
        return transport;
    }

    public int getProtocolVersion() {
        return protocolVersion;
    }

    public int getMaxPayload() {
        return maxPayload;
    }

    public String getBanner() {
        return banner;
    }

    public int allocateLocalId() {
        if(nextLocalId == Integer.MAX_VALUE) {
            throw new IllegalStateException("Local stream ids exhausted");
        }

        return nextLocalId++;
    }

    /**
     * @return true if the socket still appears to be open. A dead peer is only detected on the next read or write.
     */
    public boolean isOpen() {
        return !transport.isClosed();
    }

    @Override
    public void close() {
        log.debug("Closing connection");
        transport.close();
    }
}
