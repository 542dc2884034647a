package server;

import common.dto.msg.ConnectedMsg;
import common.dto.msg.PlayerJoinedMsg;
import common.dto.msg.PlayerLeftMsg;
import common.dto.msg.ServerInfoMsg;
import common.dto.msg.ServerMessage;
import mapper.Mapper;
import model.Player;
import model.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.ops.Metrics;

import java.net.Socket;
import java.util.List;
import java.util.Optional;

/**
 * The world plus the session registry: the one aggregate all loops share.
 * This object is also the monitor. Every method here expects the caller to hold it
 * ({@code synchronized (state) {...}}) and only queues lines, never writes to sockets.
 */
final class ServerState {
    private static final Logger log = LoggerFactory.getLogger(ServerState.class);

    final World           world;
    final SessionRegistry sessions;
    final Metrics         metrics;
    private final String  description;
    private final int     maxPlayers;

    ServerState(World world, SessionRegistry sessions, Metrics metrics, String description, int maxPlayers) {
        this.world = world;
        this.sessions = sessions;
        this.metrics = metrics;
        this.description = description;
        this.maxPlayers = maxPlayers;
    }

    /**
     * Register a session and its player. The welcome line is queued on the new session
     * before anything else can reach it; {@code player_joined} goes to {@code events}.
     */
    Session admit(Socket socket, long now, List<ServerMessage> events) throws ServerFullException {
        Session s = sessions.accept(socket, now);
        Player p = world.addPlayer(s.id());
        NetIO.send(s, new ConnectedMsg(
                s.id(), maxPlayers, sessions.size(), world.getPhase(), description, world.getDifficulty()));
        events.add(new PlayerJoinedMsg(s.id(), Mapper.toPlayerDTO(p)));
        metrics.sessionsOpened.incrementAndGet();
        log.info("Client {} connected from {} ({})", s.id(), s.remoteAddress(), occupancy());
        return s;
    }

    /**
     * Remove a session and its player. Idempotent, and matched by identity: once an id
     * has been reused, a late drop of the previous holder leaves the new one alone.
     */
    Optional<Session> release(Session s, DisconnectReason reason, List<ServerMessage> events) {
        if (sessions.get(s.id()) != s) return Optional.empty();
        Optional<Session> gone = sessions.remove(s.id());
        gone.ifPresent(g -> forget(g, reason, events));
        return gone;
    }

    /** Shutdown: close everything without announcing departures. */
    void closeAll() {
        for (Session s : sessions.clear()) {
            world.removePlayer(s.id());
            metrics.sessionsClosed.incrementAndGet();
            log.info("Client {} disconnected: {}", s.id(), DisconnectReason.SHUTDOWN);
        }
    }

    /** Drop every session whose heartbeat is older than {@code thresholdMs}. */
    List<Session> expire(long now, long thresholdMs, List<ServerMessage> events) {
        List<Session> expired = sessions.sweepTimeouts(now, thresholdMs);
        for (Session s : expired) forget(s, DisconnectReason.TIMEOUT, events);
        return expired;
    }

    ServerInfoMsg serverInfo() {
        return new ServerInfoMsg(description, maxPlayers, world.getDifficulty());
    }

    String occupancy() {
        return maxPlayers == 0
                ? "players online: " + sessions.size() + " (unlimited)"
                : "players online: " + sessions.size() + "/" + maxPlayers;
    }

    private void forget(Session s, DisconnectReason reason, List<ServerMessage> events) {
        world.removePlayer(s.id());
        events.add(new PlayerLeftMsg(s.id()));
        metrics.sessionsClosed.incrementAndGet();
        log.info("Client {} disconnected: {} ({})", s.id(), reason, occupancy());
    }
}
