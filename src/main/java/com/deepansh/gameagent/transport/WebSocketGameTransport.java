package com.deepansh.gameagent.transport;

import com.deepansh.gameagent.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link GameTransport} over a Spring WebSocket session.
 *
 * The container's I/O thread pushes text frames into an unbounded queue;
 * the agent's receive loop polls it. Close and transport errors enqueue a
 * close marker behind any pending frames, so frames that arrived before the
 * close are still delivered.
 */
@Slf4j
public class WebSocketGameTransport extends TextWebSocketHandler implements GameTransport {

    private final String url;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final Object sendLock = new Object();
    private volatile WebSocketSession session;
    private volatile boolean closed;

    private WebSocketGameTransport(String url) {
        this.url = url;
    }

    public static WebSocketGameTransport connect(WebSocketClient client, String url, Duration connectTimeout) {
        WebSocketGameTransport transport = new WebSocketGameTransport(url);
        CompletableFuture<WebSocketSession> handshake =
                client.execute(transport, new WebSocketHttpHeaders(), URI.create(url));
        try {
            transport.session = handshake.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return transport;
        } catch (TimeoutException e) {
            handshake.cancel(true);
            throw new TransportException(
                    "Timed out connecting to " + url + " after " + connectTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException("Failed to connect to " + url + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + url, e);
        }
    }

    // ─── WebSocketHandler callbacks (container thread) ───────────────────────

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        this.session = session;
        log.debug("WebSocket session opened [id={}, url={}]", session.getId(), url);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String payload = message.getPayload();
        log.debug("<< {}", payload);
        inbound.offer(Inbound.frame(payload));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error [url={}]: {}", url, exception.getMessage());
        inbound.offer(Inbound.closed("failed: " + exception.getMessage()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("WebSocket session closed [url={}, status={}]", url, status);
        inbound.offer(Inbound.closed("closed (" + status.getCode() + ")"));
    }

    // ─── GameTransport ───────────────────────────────────────────────────────

    @Override
    public Optional<String> receive(Duration timeout) throws InterruptedException {
        Inbound next = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return Optional.empty();
        }
        if (next.closeReason() != null) {
            // leave the marker in place so later calls fail the same way
            inbound.offer(next);
            throw new TransportException("Connection to " + url + " " + next.closeReason());
        }
        return Optional.of(next.text());
    }

    @Override
    public void send(String payload) {
        WebSocketSession current = session;
        if (closed || current == null || !current.isOpen()) {
            throw new TransportException("Cannot send to " + url + ": connection is not open");
        }
        try {
            // WebSocketSession does not allow concurrent writes
            synchronized (sendLock) {
                current.sendMessage(new TextMessage(payload));
            }
            log.debug(">> {}", payload);
        } catch (IOException e) {
            throw new TransportException("Failed to send to " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return !closed && current != null && current.isOpen();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error while closing WebSocket session [url={}]: {}", url, e.getMessage());
            }
        }
        inbound.offer(Inbound.closed("closed by agent"));
    }

    private record Inbound(String text, String closeReason) {

        static Inbound frame(String text) {
            return new Inbound(text, null);
        }

        static Inbound closed(String reason) {
            return new Inbound(null, reason);
        }
    }
}
