package io.rthub.transport.ws;

import java.io.IOException;

/**
 * One client socket as seen by the session pumps. Owned by exactly one {@link ClientSession}:
 * only its read pump reads, only its write pump writes.
 */
public interface SessionConnection {

    /**
     * Blocks for the next inbound frame.
     *
     * @return the frame, or null once the peer has closed
     * @throws java.net.SocketTimeoutException when nothing arrives within the idle timeout
     */
    Frame readFrame() throws IOException, InterruptedException;

    void writeText(String text) throws IOException;

    void ping() throws IOException;

    /**
     * Idempotent. Wakes a blocked {@link #readFrame()} which then returns null.
     */
    void close();

    String remoteAddress();

    /**
     * Inbound frame: client text, or a keep-alive pong.
     */
    record Frame(boolean pong, String text) {
        public static final Frame PONG = new Frame(true, null);

        public static Frame text(String text) {
            return new Frame(false, text);
        }
    }
}
