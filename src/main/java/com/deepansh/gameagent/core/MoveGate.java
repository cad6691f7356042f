package com.deepansh.gameagent.core;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Single-slot "move in flight" gate.
 *
 * At most one pending move future holds the slot. A second acquirer waits
 * until the slot is released, so commands are queued rather than interleaved.
 * {@link #close()} cancels the pending move, wakes waiters and makes every
 * later {@link #sendIfOpen} a no-op, so nothing is sent after cancellation.
 */
@Slf4j
public class MoveGate {

    private CompletableFuture<?> inFlight;
    private boolean closed;

    /**
     * Claim the slot for {@code pending}, waiting while another move holds it.
     *
     * @return false when the gate is closed or the wait was interrupted
     */
    public synchronized boolean acquire(CompletableFuture<?> pending) {
        while (inFlight != null && !closed) {
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        if (closed) {
            return false;
        }
        inFlight = pending;
        return true;
    }

    public synchronized void release(CompletableFuture<?> pending) {
        if (inFlight == pending) {
            inFlight = null;
            notifyAll();
        }
    }

    public synchronized boolean isMoveInFlight() {
        return inFlight != null;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Run {@code send} unless the gate was closed. Only the check is done under
     * the monitor; the send itself runs outside it so a stalled write never
     * blocks {@link #close()}. A close that lands after the check lets this one
     * send finish, and every later call returns false.
     */
    public boolean sendIfOpen(Runnable send) {
        synchronized (this) {
            if (closed) {
                return false;
            }
        }
        send.run();
        return true;
    }

    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (inFlight != null) {
            log.info("Cancelling in-flight move");
            inFlight.cancel(true);
        }
        notifyAll();
    }
}
