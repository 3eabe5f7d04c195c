package io.marketlens.transport.ws;

import io.marketlens.domain.data.MarketUpdate;
import io.marketlens.domain.session.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically drains each connection's outbound buffer into one BATCH frame.
 *
 * A connection whose previous batch is still being written is skipped for the
 * round, so a stalled socket only grows (and eventually overflows) its own buffer.
 */
public final class DeliveryPump {
    private static final Logger log = LoggerFactory.getLogger(DeliveryPump.class);

    private final Supplier<Collection<ClientSession>> sessions;
    private final FrameCodec codec;
    private final int batchMax;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-delivery-pump");
        t.setDaemon(true);
        return t;
    });

    public DeliveryPump(Supplier<Collection<ClientSession>> sessions, FrameCodec codec, int batchMax) {
        if (batchMax <= 0) {
            throw new IllegalArgumentException("batchMax must be positive");
        }
        this.sessions = sessions;
        this.codec = codec;
        this.batchMax = batchMax;
    }

    public void start(Duration interval) {
        long ms = Math.max(10, interval.toMillis());
        scheduler.scheduleAtFixedRate(this::flushAll, ms, ms, TimeUnit.MILLISECONDS);
        log.info("[DELIVERY] Pump started with {}ms flush interval", ms);
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    /**
     * One delivery round over every session.
     *
     * @return number of batch frames sent
     */
    public int flushAll() {
        int sent = 0;
        try {
            for (ClientSession session : sessions.get()) {
                if (flush(session)) sent++;
            }
        } catch (RuntimeException e) {
            log.warn("[DELIVERY] flush round failed: {}", e.toString());
        }
        return sent;
    }

    boolean flush(ClientSession session) {
        Connection connection = session.connection();
        if (!connection.state().acceptsDelivery() || connection.outbound().size() == 0) {
            return false;
        }
        if (!session.tryBeginBatch()) {
            log.debug("[DELIVERY] {} still writing previous batch, {} queued",
                session.id(), connection.outbound().size());
            return false;
        }
        List<MarketUpdate> batch = connection.outbound().drain(batchMax);
        if (batch.isEmpty()) {
            session.endBatch();
            return false;
        }
        try {
            session.transport().send(codec.batch(batch)).whenComplete((v, error) -> {
                session.endBatch();
                if (error != null) {
                    log.debug("[DELIVERY] batch to {} failed: {}", session.id(), error.toString());
                }
            });
        } catch (RuntimeException e) {
            session.endBatch();
            throw e;
        }
        return true;
    }
}
