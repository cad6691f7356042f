package com.deepansh.gameagent.support;

import com.deepansh.gameagent.exception.TransportException;
import com.deepansh.gameagent.transport.GameTransport;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-memory game server side of a connection.
 * Tests push inbound frames and inspect what the agent sent.
 */
public class ScriptedTransport implements GameTransport {

    private static final String DROPPED = "\u0000dropped";

    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile Consumer<String> onSend = payload -> { };

    public ScriptedTransport push(String... frames) {
        for (String frame : frames) {
            inbound.offer(frame);
        }
        return this;
    }

    /** Server-side close: buffered frames are still delivered first. */
    public ScriptedTransport drop() {
        inbound.offer(DROPPED);
        return this;
    }

    /** The connection is gone but frames already buffered can still be read. */
    public void markClosed() {
        open = false;
    }

    public void failSends() {
        failSends = true;
    }

    /** Reply hook, e.g. to push the next server frame once a move arrives. */
    public void onSend(Consumer<String> onSend) {
        this.onSend = onSend;
    }

    public List<String> getSent() {
        return sent;
    }

    @Override
    public Optional<String> receive(Duration timeout) throws InterruptedException {
        String next = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return Optional.empty();
        }
        if (DROPPED.equals(next)) {
            open = false;
            inbound.offer(DROPPED);
            throw new TransportException("connection dropped");
        }
        return Optional.of(next);
    }

    @Override
    public void send(String payload) {
        if (!open || failSends) {
            throw new TransportException("send failed");
        }
        sent.add(payload);
        onSend.accept(payload);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) return;
        open = false;
        inbound.offer(DROPPED);
    }
}
