package com.deepansh.gameagent.transport;

import lombok.RequiredArgsConstructor;
import org.springframework.web.socket.client.WebSocketClient;

import java.time.Duration;

/**
 * Opens {@link WebSocketGameTransport} connections through a shared Spring {@link WebSocketClient}.
 */
@RequiredArgsConstructor
public class SpringWebSocketTransportFactory implements GameTransportFactory {

    private final WebSocketClient webSocketClient;

    @Override
    public GameTransport open(String url, Duration connectTimeout) {
        return WebSocketGameTransport.connect(webSocketClient, url, connectTimeout);
    }
}
