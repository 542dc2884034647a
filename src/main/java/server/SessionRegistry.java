package server;

import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Connected sessions keyed by id. Ids are the smallest free positive integers,
 * so a departed player's id is handed to the next arrival.
 * <p>
 * Not thread-safe; guarded by the server monitor together with the world.
 */
final class SessionRegistry {
    private final int capacity;                       // 0 = unbounded
    private final Map<Integer, Session> sessions = new TreeMap<>();

    SessionRegistry(int capacity) {
        this.capacity = capacity;
    }

    Session accept(Socket socket, long now) throws ServerFullException {
        if (capacity > 0 && sessions.size() >= capacity) throw new ServerFullException(capacity);
        int id = 1;
        while (sessions.containsKey(id)) id++;
        Session s = new Session(id, socket, now);
        sessions.put(id, s);
        return s;
    }

    /** Close and forget. Unknown ids are a no-op. */
    Optional<Session> remove(int id) {
        Session s = sessions.remove(id);
        if (s == null) return Optional.empty();
        s.close();
        return Optional.of(s);
    }

    void touchHeartbeat(int id, long now) {
        Session s = sessions.get(id);
        if (s != null) s.touch(now);
    }

    /** Remove and return every session silent for longer than {@code thresholdMs}. */
    List<Session> sweepTimeouts(long now, long thresholdMs) {
        List<Session> expired = new ArrayList<>();
        for (Session s : sessions.values()) {
            if (now - s.lastHeartbeat() > thresholdMs) expired.add(s);
        }
        for (Session s : expired) remove(s.id());
        return expired;
    }

    Session get(int id)            { return sessions.get(id); }
    boolean contains(int id)       { return sessions.containsKey(id); }
    int     size()                 { return sessions.size(); }
    boolean isEmpty()              { return sessions.isEmpty(); }

    /** Copy for sending outside the monitor. */
    List<Session> snapshot()       { return new ArrayList<>(sessions.values()); }

    /** Close every session (shutdown). */
    List<Session> clear() {
        List<Session> all = snapshot();
        sessions.clear();
        for (Session s : all) s.close();
        return all;
    }
}
