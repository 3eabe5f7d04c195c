package io.marketlens.transport.ws;

import io.marketlens.domain.session.Connection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection paired with its transport, as tracked by the Gateway.
 */
public final class ClientSession {

    private final Connection connection;
    private final ConnectionTransport transport;
    private final AtomicBoolean batchInFlight = new AtomicBoolean(false);
    private volatile int closeCode = 1000; // normal closure

    ClientSession(Connection connection, ConnectionTransport transport) {
        this.connection = connection;
        this.transport = transport;
    }

    public Connection connection() {
        return connection;
    }

    public ConnectionTransport transport() {
        return transport;
    }

    public String id() {
        return connection.connectionId();
    }

    /**
     * WebSocket close code used once the connection reaches CLOSED.
     */
    int closeCode() {
        return closeCode;
    }

    void closeCode(int code) {
        this.closeCode = code;
    }

    /**
     * @return false if the previous batch has not been written yet
     */
    boolean tryBeginBatch() {
        return batchInFlight.compareAndSet(false, true);
    }

    void endBatch() {
        batchInFlight.set(false);
    }
}
