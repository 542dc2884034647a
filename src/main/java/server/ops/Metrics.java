package server.ops;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

public final class Metrics {
    private static final ObjectMapper M = new ObjectMapper();

    // ---- Counters (monotonic) ----
    public final AtomicLong sessionsOpened      = new AtomicLong();
    public final AtomicLong sessionsClosed      = new AtomicLong();
    public final AtomicLong connectionsRejected = new AtomicLong();
    public final AtomicLong malformedLines      = new AtomicLong();
    public final AtomicLong chasersSlain        = new AtomicLong();
    public final AtomicLong playerDeaths        = new AtomicLong();
    public final AtomicLong bulletsFired        = new AtomicLong();

    // tick timing (EWMA & last)
    private volatile double tickMsEwma = 0.0;
    private volatile double tickMsLast = 0.0;
    private static final double ALPHA = 0.2;

    // live gauge, bound from GameServer
    private volatile IntSupplier sessionsGauge = () -> -1;

    public void bindSessions(IntSupplier gauge) {
        sessionsGauge = gauge;
    }

    public void observeTickNanos(long nanos) {
        double ms = nanos / 1_000_000.0;
        tickMsLast = ms;
        tickMsEwma = (tickMsEwma == 0.0) ? ms : (ALPHA * ms + (1 - ALPHA) * tickMsEwma);
    }

    public ObjectNode snapshot() {
        ObjectNode n = M.createObjectNode();
        n.put("sessions_opened",      sessionsOpened.get());
        n.put("sessions_closed",      sessionsClosed.get());
        n.put("connections_rejected", connectionsRejected.get());
        n.put("malformed_lines",      malformedLines.get());
        n.put("chasers_slain",        chasersSlain.get());
        n.put("player_deaths",        playerDeaths.get());
        n.put("bullets_fired",        bulletsFired.get());
        n.put("gauge_sessions",       sessionsGauge.getAsInt());
        n.put("tick_ms_last",         tickMsLast);
        n.put("tick_ms_ewma",         tickMsEwma);
        return n;
    }

    public String snapshotJson() {
        return snapshot().toString();
    }
}
