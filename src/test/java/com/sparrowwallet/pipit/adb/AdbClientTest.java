package com.sparrowwallet.pipit.adb;

import com.sparrowwallet.pipit.DeviceConnectionRefusedException;
import com.sparrowwallet.pipit.DeviceException;
import com.sparrowwallet.pipit.DeviceNotTrustedException;
import com.sparrowwallet.pipit.PipitConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AdbClientTest {
    private FakeAdbDaemon daemon;

    @AfterEach
    public void tearDown() throws IOException {
        if(daemon != null) {
            daemon.close();
        }
    }

    static PipitConfig testConfig(int port) {
        PipitConfig config = new PipitConfig();
        config.host = "127.0.0.1";
        config.port = port;
        config.connectTimeout = 1000;
        config.readTimeout = 2000;
        config.trustTimeout = 2000;
        config.drainTimeout = 200;
        return config;
    }

    @Test
    public void testConnectionIsReused() throws Exception {
        daemon = new FakeAdbDaemon(false);
        try(AdbClient client = new AdbClient(testConfig(daemon.getPort()), TestKeys.keyPair())) {
            assertTrue(client.execute("input keyevent 19"));
            assertTrue(client.execute("input keyevent 20"));
            assertTrue(client.execute("input keyevent 23"));

            assertEquals(1, client.getConnectionCount());
            assertEquals(1, daemon.getConnectionCount());
            List<Integer> localIds = daemon.getReceived(AdbCommand.OPEN).stream().map(AdbMessage::getArg0).collect(Collectors.toList());
            assertEquals(List.of(1, 2, 3), localIds);
        }
    }

    @Test
    public void testReconnectsOnceAfterFailure() throws Exception {
        daemon = new FakeAdbDaemon(false);
        try(AdbClient client = new AdbClient(testConfig(daemon.getPort()), TestKeys.keyPair())) {
            assertTrue(client.execute("input keyevent 19"));

            daemon.failNextOpens(1);
            assertTrue(client.execute("input keyevent 20"));

            assertEquals(2, client.getConnectionCount());
            assertEquals(3, daemon.getReceived(AdbCommand.OPEN).size());
            assertTrue(client.isConnected());
        }
    }

    @Test
    public void testNoSecondRetry() throws Exception {
        daemon = new FakeAdbDaemon(false);
        try(AdbClient client = new AdbClient(testConfig(daemon.getPort()), TestKeys.keyPair())) {
            assertTrue(client.execute("input keyevent 19"));

            daemon.failNextOpens(2);
            assertThrows(DeviceException.class, () -> client.execute("input keyevent 20"));
            assertEquals(3, daemon.getReceived(AdbCommand.OPEN).size());
            assertEquals(2, client.getConnectionCount());
            assertFalse(client.isConnected());

            assertTrue(client.execute("input keyevent 21"));
            assertEquals(4, daemon.getReceived(AdbCommand.OPEN).size());
            assertEquals(3, client.getConnectionCount());
        }
    }

    @Test
    public void testConcurrentCallersShareConnection() throws Exception {
        daemon = new FakeAdbDaemon(false);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try(AdbClient client = new AdbClient(testConfig(daemon.getPort()), TestKeys.keyPair())) {
            client.connect();

            List<Callable<Boolean>> tasks = new ArrayList<>();
            for(int i = 0; i < 16; i++) {
                String command = "input keyevent " + (19 + i % 5);
                tasks.add(() -> client.execute(command));
            }

            for(Future<Boolean> future : executor.invokeAll(tasks, 30, TimeUnit.SECONDS)) {
                assertTrue(future.get());
            }

            assertEquals(1, client.getConnectionCount());
            assertEquals(1, daemon.getConnectionCount());
            List<AdbMessage> opens = daemon.getReceived(AdbCommand.OPEN);
            assertEquals(16, opens.size());
            Set<Integer> localIds = opens.stream().map(AdbMessage::getArg0).collect(Collectors.toSet());
            assertEquals(16, localIds.size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testConnectionRefused() throws Exception {
        int port;
        try(ServerSocket serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = serverSocket.getLocalPort();
        }

        try(AdbClient client = new AdbClient(testConfig(port), TestKeys.keyPair())) {
            assertThrows(DeviceConnectionRefusedException.class, client::connect);
            assertThrows(DeviceConnectionRefusedException.class, () -> client.execute("input keyevent 23"));
            assertEquals(0, client.getConnectionCount());
        }
    }

    @Test
    public void testPublicKeyTrustedOnce() throws Exception {
        daemon = new FakeAdbDaemon(true);
        try(AdbClient client = new AdbClient(testConfig(daemon.getPort()), TestKeys.keyPair())) {
            assertTrue(client.execute("input keyevent 23"));
        }

        try(AdbClient client = new AdbClient(testConfig(daemon.getPort()), TestKeys.keyPair())) {
            assertTrue(client.execute("input keyevent 23"));
        }

        assertEquals(2, daemon.getConnectionCount());
        assertEquals(1, daemon.getReceivedAuth(AuthType.RSAPUBLICKEY).size());
        assertEquals(2, daemon.getReceivedAuth(AuthType.SIGNATURE).size());
    }

    @Test
    public void testPublicKeyRejected() throws Exception {
        daemon = new FakeAdbDaemon(true);
        daemon.setAcceptPublicKeys(false);
        try(AdbClient client = new AdbClient(testConfig(daemon.getPort()), TestKeys.keyPair())) {
            assertThrows(DeviceNotTrustedException.class, () -> client.execute("input keyevent 23"));
            assertFalse(client.isConnected());
            assertTrue(daemon.getReceived(AdbCommand.OPEN).isEmpty());
        }
    }
}
