package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceConnectionRefusedException;
import com.sparrowwallet.pipit.DeviceException;
import com.sparrowwallet.pipit.DeviceTimeoutException;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;

/**
 * TCP transport to the daemon's loopback port.
 *
 * A read timeout bounds the wait for the first byte of a frame only, and is reported as a
 * {@link DeviceTimeoutException} with the transport left open. Once a frame has started arriving the rest
 * of it is read with the default timeout. Failing to complete a frame closes the transport, since the
 * stream has lost frame alignment.
 */
public class SocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final int defaultTimeout;
    private boolean closed = false;

    /**
     * Connect to the daemon.
     *
     * @param host Daemon host, normally the loopback address
     * @param port Daemon port
     * @param connectTimeoutMs TCP connect timeout
     * @param defaultTimeoutMs Default read timeout
     * @throws DeviceException if the connection cannot be established
     */
    public SocketTransport(String host, int port, int connectTimeoutMs, int defaultTimeoutMs) throws DeviceException {
        this.defaultTimeout = defaultTimeoutMs;
        this.socket = new Socket();

        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            socket.setSoTimeout(defaultTimeoutMs);
            this.in = new BufferedInputStream(socket.getInputStream());
            this.out = new BufferedOutputStream(socket.getOutputStream());
        } catch(ConnectException e) {
            closeQuietly();
            throw new DeviceConnectionRefusedException("Connection refused by " + host + ":" + port + ", is network debugging enabled?", e);
        } catch(SocketTimeoutException e) {
            closeQuietly();
            throw new DeviceTimeoutException("Timed out connecting to " + host + ":" + port + " after " + connectTimeoutMs + "ms", e);
        } catch(IOException e) {
            closeQuietly();
            throw new DeviceException("Could not connect to " + host + ":" + port + ": " + e.getMessage(), e);
        } catch(RuntimeException e) {
            closeQuietly();
            throw e;
        }

        log.debug("Socket transport connected to {}:{}", host, port);
    }

    @Override
    public void write(AdbMessage message) throws DeviceException {
        if(closed) {
            throw new DeviceException("Socket transport is closed");
        }

        try {
            MessageCodec.writeMessage(out, message);
        } catch(IOException e) {
            throw new DeviceException("Socket write failed: " + e.getMessage(), e);
        }

        if(log.isTraceEnabled()) {
            log.trace("> {} {}", message, Hex.encodeHexString(message.getPayload()));
        }
    }

    @Override
    public AdbMessage read() throws DeviceException {
        return read(defaultTimeout);
    }

    @Override
    public AdbMessage read(int timeoutMs) throws DeviceException {
        if(closed) {
            throw new DeviceException("Socket transport is closed");
        }

        try {
            socket.setSoTimeout(timeoutMs);
            in.mark(1);
            int first = in.read();
            if(first < 0) {
                close();
                throw new DeviceException("Connection closed by daemon");
            }
            in.reset();
        } catch(SocketTimeoutException e) {
            throw new DeviceTimeoutException("Socket read timeout after " + timeoutMs + "ms", e);
        } catch(IOException e) {
            close();
            throw new DeviceException("Socket read failed: " + e.getMessage(), e);
        }

        //a frame has started arriving, any failure from here on leaves the stream out of alignment
        AdbMessage message;
        try {
            socket.setSoTimeout(defaultTimeout);
            message = MessageCodec.readMessage(in);
        } catch(IOException e) {
            close();
            throw new DeviceException("Socket read failed mid-frame: " + e.getMessage(), e);
        } catch(DeviceException e) {
            close();
            throw e;
        }

        if(message == null) {
            close();
            throw new DeviceException("Connection closed by daemon mid-frame");
        }

        if(log.isTraceEnabled()) {
            log.trace("< {} {}", message, Hex.encodeHexString(message.getPayload()));
        }

        return message;
    }

    @Override
    public void close() {
        if(!closed) {
            closeQuietly();
            closed = true;
            log.debug("Socket transport closed");
        }
    }

    @Override
    public boolean isClosed() {
        return closed || socket.isClosed() || !socket.isConnected();
    }

    private void closeQuietly() {
        try {
            socket.close();
        } catch(IOException e) {
            log.warn("Error closing socket", e);
        }
    }
}
