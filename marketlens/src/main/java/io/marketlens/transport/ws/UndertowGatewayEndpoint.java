package io.marketlens.transport.ws;

import io.marketlens.auth.AuthenticationException;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Undertow WebSocket endpoint for the {@link Gateway}.
 *
 * The credential comes from {@code ?token=xxx} or an {@code Authorization: Bearer xxx} header.
 */
public final class UndertowGatewayEndpoint {
    private static final Logger log = LoggerFactory.getLogger(UndertowGatewayEndpoint.class);

    private final Gateway gateway;

    public UndertowGatewayEndpoint(Gateway gateway) {
        this.gateway = gateway;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String credential = extractToken(exchange.getQueryString());
                if (credential == null) {
                    credential = bearer(exchange.getRequestHeader("Authorization"));
                }

                ClientSession session;
                try {
                    session = gateway.open(new UndertowTransport(channel), credential);
                } catch (AuthenticationException e) {
                    log.debug("[WS] Handshake rejected: {}", e.getMessage());
                    return;
                }

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        gateway.onMessage(session, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        gateway.onTransportClosed(session);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[WS] Error on {}: {}", session.id(), error.toString());
                        gateway.onTransportClosed(session);
                        super.onError(ch, error);
                    }
                });
                channel.addCloseTask(ch -> gateway.onTransportClosed(session));
                channel.resumeReceives();
            }
        });
    }

    static String extractToken(String query) {
        if (query == null) {
            return null;
        }
        for (String param : query.split("&")) {
            if (param.startsWith("token=")) {
                return URLDecoder.decode(param.substring(6), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    static String bearer(String header) {
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        return header.substring(7).trim();
    }
}
