package io.rthub.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import io.rthub.util.Json;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory socket: the test plays the client side.
 */
public final class FakeConnection implements SessionConnection {

    private static final SessionConnection.Frame EOF = new SessionConnection.Frame(false, "<eof>");

    private final BlockingQueue<SessionConnection.Frame> inbound = new LinkedBlockingQueue<>();
    private final List<String> written = new CopyOnWriteArrayList<>();
    private final AtomicInteger pings = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final String address;

    private volatile CountDownLatch writeGate;
    private volatile boolean failWrites;

    public FakeConnection(String address) {
        this.address = address;
    }

    // ── client side ──

    public void clientSends(String text) {
        inbound.offer(SessionConnection.Frame.text(text));
    }

    public void clientPongs() {
        inbound.offer(SessionConnection.Frame.PONG);
    }

    public void peerCloses() {
        inbound.offer(EOF);
    }

    /**
     * Writes block until the returned latch is released.
     */
    public CountDownLatch blockWrites() {
        CountDownLatch gate = new CountDownLatch(1);
        writeGate = gate;
        return gate;
    }

    public void failWrites() {
        failWrites = true;
    }

    public List<String> written() {
        return List.copyOf(written);
    }

    public List<JsonNode> writtenFrames() {
        return written.stream().map(FakeConnection::parse).toList();
    }

    public List<JsonNode> framesOfType(String type) {
        return writtenFrames().stream().filter(f -> type.equals(f.path("type").asText())).toList();
    }

    public int pings() {
        return pings.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ── server side ──

    @Override
    public SessionConnection.Frame readFrame() throws IOException, InterruptedException {
        SessionConnection.Frame frame = inbound.poll(30, TimeUnit.SECONDS);
        if (frame == null) {
            throw new SocketTimeoutException("fake idle timeout");
        }
        if (frame == EOF) {
            inbound.offer(EOF);
            return null;
        }
        return frame;
    }

    @Override
    public void writeText(String text) throws IOException {
        CountDownLatch gate = writeGate;
        if (gate != null) {
            try {
                gate.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while blocked", e);
            }
        }
        if (failWrites) {
            throw new IOException("broken pipe");
        }
        written.add(text);
    }

    @Override
    public void ping() {
        pings.incrementAndGet();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            inbound.offer(EOF);
        }
    }

    @Override
    public String remoteAddress() {
        return address;
    }

    private static JsonNode parse(String json) {
        try {
            return Json.MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalStateException("server wrote invalid JSON: " + json, e);
        }
    }
}
