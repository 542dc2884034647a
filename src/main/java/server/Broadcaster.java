package server;

import common.dto.msg.GameStateMsg;
import common.dto.msg.ServerMessage;
import mapper.Mapper;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fans messages out to every session. Recipients and snapshot contents are copied
 * under the monitor; lines are queued after it is released.
 */
final class Broadcaster {
    private final ServerState state;

    Broadcaster(ServerState state) {
        this.state = state;
    }

    /**
     * Queue one {@code game_state} snapshot for everyone, if anyone is connected.
     *
     * @return sessions that could not take it; the caller tears them down
     */
    List<Session> publishSnapshot() {
        GameStateMsg snapshot;
        List<Session> recipients;
        synchronized (state) {
            if (state.sessions.isEmpty()) return List.of();
            snapshot = Mapper.toGameState(state.world);
            recipients = state.sessions.snapshot();
        }
        return NetIO.fanOut(recipients, snapshot);
    }

    /** Queue discrete events, in order, for everyone. Same failure contract as above. */
    List<Session> publish(List<ServerMessage> events) {
        if (events.isEmpty()) return List.of();
        List<Session> recipients;
        synchronized (state) {
            recipients = state.sessions.snapshot();
        }
        Set<Session> failed = new LinkedHashSet<>();
        for (ServerMessage m : events) failed.addAll(NetIO.fanOut(recipients, m));
        return List.copyOf(failed);
    }
}
