package io.marketlens.transport.ws;

import java.util.concurrent.CompletionStage;

/**
 * Outbound side of one client connection, independent of the server library.
 */
public interface ConnectionTransport {

    String remoteAddress();

    /**
     * Queue one text frame. Never blocks; the stage completes once the frame
     * is written or fails.
     */
    CompletionStage<Void> send(String frame);

    void close(int code, String reason);

    boolean isOpen();
}
