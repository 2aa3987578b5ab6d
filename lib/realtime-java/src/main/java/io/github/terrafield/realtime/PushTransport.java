package io.github.terrafield.realtime;

/**
 * Persistent push connection. One instance serves one connection attempt.
 * <p>
 * {@link #open(Listener)} returns immediately; the outcome arrives through the listener,
 * possibly on another thread.
 */
public interface PushTransport {

    /**
     * Receives transport events.
     */
    interface Listener {
        /** the connection is established */
        void onOpen();

        /** a complete text frame arrived */
        void onMessage(String text);

        /** the connection failed or broke */
        void onError(Throwable error);

        /** the remote side closed the connection */
        void onClosed(int code, String reason);
    }

    /**
     * Starts connecting.
     *
     * @param listener receives the outcome and every inbound frame
     */
    void open(Listener listener);

    /**
     * Checks whether frames can be sent.
     *
     * @return true while the connection is open
     */
    boolean isOpen();

    /**
     * Queues a text frame for sending.
     *
     * @param text the frame
     * @return true if the frame was accepted for an open connection
     */
    boolean send(String text);

    /**
     * Closes the connection. Safe to call multiple times.
     */
    void close();
}
