package com.shipyard.core.events;

/**
 * A single subscriber registered with the {@link EventHub}.
 * <p>
 * Implementations wrap one transport (HTTP event stream, WebSocket, in-process queue).
 * {@link #send} must return within a bounded time; a slow or dead peer is reported as
 * {@code false} rather than blocking the publisher.
 */
public interface Connection {

    /** Unique id, echoed to the client in the {@code connected} and {@code heartbeat} events. */
    String id();

    /**
     * Writes one event to the underlying transport.
     *
     * @param event the event being delivered
     * @param frame {@code event} already encoded by {@link EventFrames#encode}; the same frame is
     *              shared by every connection of the publish
     * @return {@code true} if the event was written, {@code false} if the sink is closed or the write failed
     */
    boolean send(ShipyardEvent event, String frame);

    /** Closes the underlying transport. Calling it more than once is harmless. */
    void close();

    /** Transport label reported in the {@code connected} event. */
    default String transport() {
        return "sse";
    }
}
