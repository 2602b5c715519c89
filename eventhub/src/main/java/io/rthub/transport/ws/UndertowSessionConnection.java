package io.rthub.transport.ws;

import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedBinaryMessage;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapts an Undertow {@link WebSocketChannel} to the blocking pump model.
 * Undertow's IO thread hands inbound frames over through a bounded queue;
 * writes use the blocking send helpers from the pump thread.
 */
final class UndertowSessionConnection implements SessionConnection {
    private static final Logger log = LoggerFactory.getLogger(UndertowSessionConnection.class);

    static final long MAX_FRAME_BYTES = 512 * 1024;

    private static final SessionConnection.Frame EOF = SessionConnection.Frame.text(null);

    private final WebSocketChannel channel;
    private final Duration idleTimeout;
    private final BlockingQueue<SessionConnection.Frame> inbound;
    private final AtomicBoolean eof = new AtomicBoolean(false);

    UndertowSessionConnection(WebSocketChannel channel, Duration idleTimeout, int inboundCapacity) {
        this.channel = channel;
        this.idleTimeout = idleTimeout;
        this.inbound = new LinkedBlockingQueue<>(inboundCapacity);
    }

    /**
     * Installs the receive listener and starts reading. Call once, before the pumps start.
     */
    void bind() {
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                enqueue(SessionConnection.Frame.text(message.getData()));
            }

            @Override
            protected void onFullPongMessage(WebSocketChannel ch, BufferedBinaryMessage message) throws IOException {
                enqueue(SessionConnection.Frame.PONG);
                super.onFullPongMessage(ch, message);
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                signalEof();
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.debug("[HUB] Socket error from {}: {}", ch.getSourceAddress(), error.toString());
                signalEof();
                super.onError(ch, error);
            }

            @Override
            protected long getMaxTextBufferSize() {
                return MAX_FRAME_BYTES;
            }
        });
        channel.addCloseTask(ch -> signalEof());
        channel.resumeReceives();
    }

    private void enqueue(SessionConnection.Frame frame) {
        if (eof.get()) {
            return;
        }
        if (!inbound.offer(frame)) {
            log.warn("[HUB] Inbound queue full for {}, dropping client frame", remoteAddress());
        }
    }

    private void signalEof() {
        if (eof.compareAndSet(false, true)) {
            inbound.clear();
            inbound.offer(EOF);
        }
    }

    @Override
    public SessionConnection.Frame readFrame() throws IOException, InterruptedException {
        SessionConnection.Frame frame = inbound.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (frame == null) {
            throw new SocketTimeoutException("no inbound frame within " + idleTimeout);
        }
        if (frame == EOF) {
            // keep the marker for any later read
            inbound.offer(EOF);
            return null;
        }
        return frame;
    }

    @Override
    public void writeText(String text) throws IOException {
        WebSockets.sendTextBlocking(text, channel);
    }

    @Override
    public void ping() throws IOException {
        WebSockets.sendPingBlocking(ByteBuffer.allocate(0), channel);
    }

    @Override
    public void close() {
        signalEof();
        if (channel.isOpen()) {
            try {
                channel.sendClose();
            } catch (IOException e) {
                log.debug("[HUB] Close handshake failed for {}: {}", remoteAddress(), e.toString());
            }
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[HUB] Channel close failed for {}: {}", remoteAddress(), e.toString());
        }
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.getSourceAddress());
    }
}
