package com.ssot.broadcast;

/**
 * A connected remote client receiving serialized change messages.
 *
 * <p>Implementations wrap the actual transport (a WebSocket session, an SSE stream, a queue).
 * {@link #send(String)} is called from the broadcaster's delivery thread and may throw; the
 * failure is logged and counted without affecting other sinks.
 */
public interface MessageSink {

    /**
     * @return false once the client has disconnected; closed sinks are skipped
     */
    boolean isOpen();

    void send(String message);
}
