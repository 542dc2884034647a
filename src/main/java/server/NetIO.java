// server/NetIO.java
package server;

import common.dto.msg.GameStateMsg;
import common.dto.msg.ServerMessage;
import net.Wire;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

final class NetIO {
    private NetIO() {}

    static boolean send(Session s, ServerMessage m) {
        if (s == null) return false;
        return sendLine(s, Wire.encode(m), m instanceof GameStateMsg);
    }

    /**
     * Encode once, queue for every session.
     *
     * @return sessions that refused the line (already closed)
     */
    static List<Session> fanOut(Collection<Session> to, ServerMessage m) {
        String line = Wire.encode(m);
        boolean snapshot = m instanceof GameStateMsg;
        List<Session> failed = new ArrayList<>();
        for (Session s : to) {
            if (!sendLine(s, line, snapshot)) failed.add(s);
        }
        return failed;
    }

    private static boolean sendLine(Session s, String line, boolean snapshot) {
        return snapshot ? s.offerSnapshot(line) : s.offerPriority(line);
    }
}
