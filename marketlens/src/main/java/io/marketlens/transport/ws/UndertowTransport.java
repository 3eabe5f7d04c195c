package io.marketlens.transport.ws;

import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link ConnectionTransport} over an Undertow WebSocket channel.
 */
final class UndertowTransport implements ConnectionTransport {
    private static final Logger log = LoggerFactory.getLogger(UndertowTransport.class);

    private final WebSocketChannel channel;
    private final String remoteAddress;

    UndertowTransport(WebSocketChannel channel) {
        this.channel = channel;
        this.remoteAddress = String.valueOf(channel.getSourceAddress());
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public CompletionStage<Void> send(String frame) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        WebSockets.sendText(frame, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                result.complete(null);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                result.completeExceptionally(throwable);
            }
        });
        return result;
    }

    @Override
    public void close(int code, String reason) {
        if (!channel.isOpen()) {
            return;
        }
        WebSockets.sendClose(code, reason, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                closeQuietly(ch);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.debug("[WS] close frame to {} failed: {}", remoteAddress, throwable.toString());
                closeQuietly(ch);
            }
        });
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    private void closeQuietly(WebSocketChannel ch) {
        try {
            ch.close();
        } catch (IOException e) {
            log.debug("[WS] channel close for {} failed: {}", remoteAddress, e.toString());
        }
    }
}
