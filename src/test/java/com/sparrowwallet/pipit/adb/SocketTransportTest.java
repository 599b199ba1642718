package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceException;
import com.sparrowwallet.pipit.DeviceTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SocketTransportTest {
    private static final int DEFAULT_TIMEOUT = 300;

    private ServerSocket serverSocket;
    private SocketTransport transport;
    private Socket daemonSide;

    @BeforeEach
    public void setUp() throws Exception {
        serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        transport = new SocketTransport("127.0.0.1", serverSocket.getLocalPort(), 1000, DEFAULT_TIMEOUT);
        daemonSide = serverSocket.accept();
    }

    @AfterEach
    public void tearDown() throws IOException {
        transport.close();
        daemonSide.close();
        serverSocket.close();
    }

    private static byte[] frame(AdbMessage message) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MessageCodec.writeMessage(out, message);
        return out.toByteArray();
    }

    private void send(byte[] bytes) throws IOException {
        OutputStream out = daemonSide.getOutputStream();
        out.write(bytes);
        out.flush();
    }

    @Test
    public void testTimeoutBeforeFrameKeepsTransportOpen() throws Exception {
        assertThrows(DeviceTimeoutException.class, () -> transport.read(100));
        assertFalse(transport.isClosed());

        AdbMessage okay = AdbMessage.okay(9, 1);
        send(frame(okay));
        assertEquals(okay, transport.read(100));
    }

    @Test
    public void testStalledFrameClosesTransport() throws Exception {
        byte[] write = frame(AdbMessage.write(9, 1, "output".getBytes(StandardCharsets.UTF_8)));
        send(Arrays.copyOf(write, 10));

        DeviceException e = assertThrows(DeviceException.class, () -> transport.read(100));
        assertFalse(e instanceof DeviceTimeoutException);
        assertTrue(transport.isClosed());
        assertThrows(DeviceException.class, () -> transport.read(100));
    }

    @Test
    public void testStalledOutputFailsCommand() throws Exception {
        AdbConnection connection = new AdbConnection(transport, new HandshakeStateMachine.Result(MessageCodec.VERSION, MessageCodec.MAX_PAYLOAD, "device::", HandshakeStateMachine.AuthMethod.NONE));
        byte[] okay = frame(AdbMessage.okay(9, 1));
        byte[] write = frame(AdbMessage.write(9, 1, "output".getBytes(StandardCharsets.UTF_8)));
        byte[] stalled = new byte[okay.length + 10];
        System.arraycopy(okay, 0, stalled, 0, okay.length);
        System.arraycopy(write, 0, stalled, okay.length, 10);
        send(stalled);

        StreamMultiplexer multiplexer = new StreamMultiplexer(10, 100);
        assertThrows(DeviceException.class, () -> multiplexer.runCommand(connection, 1, "input keyevent 23"));
        assertFalse(connection.isOpen());
    }

    @Test
    public void testDaemonDisconnectClosesTransport() throws Exception {
        daemonSide.close();

        assertThrows(DeviceException.class, () -> transport.read(1000));
        assertTrue(transport.isClosed());
    }
}
