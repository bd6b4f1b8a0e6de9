package com.questrail.janus.transport;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Test listener that queues inbound datagrams and records transport state.
 */
public final class RecordingDatagramListener implements DatagramEndpointListener {

    public record Received(SocketAddress from, byte[] payload) {}

    private final BlockingQueue<Received> received = new LinkedBlockingQueue<>();
    private final CountDownLatch up = new CountDownLatch(1);
    private final CountDownLatch down = new CountDownLatch(1);
    private volatile Throwable downCause;

    @Override
    public void onTransportUp() {
        up.countDown();
    }

    @Override
    public void onTransportDown(Throwable cause) {
        downCause = cause;
        down.countDown();
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        received.add(new Received(remote, payload));
    }

    public boolean awaitUp(Duration timeout) throws InterruptedException {
        return up.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean awaitDown(Duration timeout) throws InterruptedException {
        return down.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Throwable downCause() {
        return downCause;
    }

    /**
     * @return the next datagram, or {@code null} if none arrives in time
     */
    public Received poll(Duration timeout) throws InterruptedException {
        return received.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int pending() {
        return received.size();
    }
}
