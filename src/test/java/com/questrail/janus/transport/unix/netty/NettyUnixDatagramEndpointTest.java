package com.questrail.janus.transport.unix.netty;

import com.questrail.janus.transport.DatagramEndpoint;
import com.questrail.janus.transport.DeliveryException;
import com.questrail.janus.transport.RecordingDatagramListener;
import com.questrail.janus.transport.unix.ReplyAddresses;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Exercises the native transport against real socket files. Skipped where the
 * epoll transport is unavailable.
 */
class NettyUnixDatagramEndpointTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    private NettyUnixDatagramEndpointFactory factory;

    @BeforeEach
    void setUp() {
        assumeTrue(NettyUnixDatagramEndpointFactory.isAvailable(), "native epoll transport unavailable");
        factory = new NettyUnixDatagramEndpointFactory(65536);
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private DatagramEndpoint bound(Path path, RecordingDatagramListener listener) throws InterruptedException {
        DatagramEndpoint ep = factory.create(ReplyAddresses.address(path));
        ep.setListener(listener);
        ep.start();
        assertTrue(listener.awaitUp(WAIT), "endpoint did not come up");
        return ep;
    }

    @Test
    void boundEndpointsExchangeDatagrams() throws Exception {
        Path a = dir.resolve("a.sock");
        Path b = dir.resolve("b.sock");
        RecordingDatagramListener la = new RecordingDatagramListener();
        RecordingDatagramListener lb = new RecordingDatagramListener();
        DatagramEndpoint epA = bound(a, la);
        DatagramEndpoint epB = bound(b, lb);
        try {
            assertTrue(Files.exists(a));

            epA.send(ReplyAddresses.address(b), "hello".getBytes(StandardCharsets.UTF_8)).get(5, TimeUnit.SECONDS);

            RecordingDatagramListener.Received r = lb.poll(WAIT);
            assertNotNull(r);
            assertEquals("hello", new String(r.payload(), StandardCharsets.UTF_8));
            assertEquals(a.toString(), ReplyAddresses.pathOf(r.from()));
        } finally {
            epA.stop();
            epB.stop();
        }
    }

    @Test
    void sendOnlyEndpointReachesBoundPeer() throws Exception {
        Path server = dir.resolve("server.sock");
        RecordingDatagramListener ls = new RecordingDatagramListener();
        DatagramEndpoint epS = bound(server, ls);

        RecordingDatagramListener lc = new RecordingDatagramListener();
        DatagramEndpoint sender = factory.create(null);
        sender.setListener(lc);
        sender.start();
        try {
            assertTrue(lc.awaitUp(WAIT));

            sender.send(ReplyAddresses.address(server), new byte[] {'{', '}'}).get(5, TimeUnit.SECONDS);

            assertNotNull(ls.poll(WAIT));
        } finally {
            sender.stop();
            epS.stop();
        }
    }

    @Test
    void sendToMissingSocketFailsAsTargetMissing() throws Exception {
        RecordingDatagramListener l = new RecordingDatagramListener();
        DatagramEndpoint ep = bound(dir.resolve("c.sock"), l);
        try {
            ExecutionException e = assertThrows(ExecutionException.class, () ->
                    ep.send(ReplyAddresses.address(dir.resolve("nobody.sock")), new byte[] {1})
                            .get(5, TimeUnit.SECONDS));

            DeliveryException d = assertInstanceOf(DeliveryException.class, e.getCause());
            assertTrue(d.isTargetMissing(), d.getMessage());
        } finally {
            ep.stop();
        }
    }

    @Test
    void bindingAnExistingPathReportsDown() throws Exception {
        Path p = dir.resolve("taken.sock");
        RecordingDatagramListener first = new RecordingDatagramListener();
        DatagramEndpoint owner = bound(p, first);
        try {
            RecordingDatagramListener second = new RecordingDatagramListener();
            DatagramEndpoint squatter = factory.create(ReplyAddresses.address(p));
            squatter.setListener(second);
            squatter.start();

            assertTrue(second.awaitDown(WAIT));
            assertNotNull(second.downCause());
        } finally {
            owner.stop();
        }
    }

    @Test
    void stopDuringBindSettlesAfterTheSocketFileExists() throws Exception {
        for (int i = 0; i < 20; i++) {
            Path p = dir.resolve("racing-" + i + ".sock");
            DatagramEndpoint ep = factory.create(ReplyAddresses.address(p));
            ep.setListener(new RecordingDatagramListener());
            ep.start();

            ep.stop().get(5, TimeUnit.SECONDS);
            Files.deleteIfExists(p);

            assertFalse(Files.exists(p), "socket file reappeared after stop settled: " + p);
        }
        try (Stream<Path> left = Files.list(dir)) {
            assertEquals(0, left.count());
        }
    }

    @Test
    void stoppedEndpointCannotBeStarted() throws Exception {
        DatagramEndpoint ep = factory.create(ReplyAddresses.address(dir.resolve("never.sock")));
        ep.setListener(new RecordingDatagramListener());

        ep.stop().get(5, TimeUnit.SECONDS);

        assertThrows(IllegalStateException.class, ep::start);
        assertFalse(Files.exists(dir.resolve("never.sock")));
    }

    @Test
    void stoppedEndpointRefusesToSend() throws Exception {
        RecordingDatagramListener l = new RecordingDatagramListener();
        DatagramEndpoint ep = bound(dir.resolve("d.sock"), l);

        ep.stop();

        assertTrue(l.awaitDown(WAIT));
        assertNull(l.downCause());
        ExecutionException e = assertThrows(ExecutionException.class, () ->
                ep.send(ReplyAddresses.address(dir.resolve("d.sock")), new byte[] {1}).get(5, TimeUnit.SECONDS));
        assertEquals(DeliveryException.Reason.TRANSPORT_DOWN,
                assertInstanceOf(DeliveryException.class, e.getCause()).reason());
    }

    @Test
    void startWithoutListenerIsRejected() {
        DatagramEndpoint ep = factory.create(ReplyAddresses.address(dir.resolve("e.sock")));

        assertThrows(IllegalStateException.class, ep::start);
    }
}
