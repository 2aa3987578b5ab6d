package io.github.terrafield.realtime;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable {@link PushTransport}; the test decides when it opens, fails or receives frames.
 */
final class FakePushTransport implements PushTransport {

    final List<String> sent = new ArrayList<>();
    private Listener listener;
    private boolean open;
    private boolean closed;

    @Override
    public void open(Listener listener) {
        this.listener = listener;
    }

    @Override
    public boolean isOpen() {
        return open && !closed;
    }

    @Override
    public boolean send(String text) {
        if (!isOpen()) {
            return false;
        }
        sent.add(text);
        return true;
    }

    @Override
    public void close() {
        closed = true;
        open = false;
    }

    boolean isClosed() {
        return closed;
    }

    void accept() {
        open = true;
        listener.onOpen();
    }

    void receive(String frame) {
        listener.onMessage(frame);
    }

    void fail(String message) {
        open = false;
        listener.onError(new IOException(message));
    }

    void remoteClose(int code, String reason) {
        open = false;
        listener.onClosed(code, reason);
    }

    /**
     * Factory recording every transport it hands out.
     */
    static final class Factory implements PushTransportFactory {
        final List<FakePushTransport> created = new ArrayList<>();

        @Override
        public PushTransport create() {
            FakePushTransport transport = new FakePushTransport();
            created.add(transport);
            return transport;
        }

        FakePushTransport last() {
            return created.get(created.size() - 1);
        }
    }
}
