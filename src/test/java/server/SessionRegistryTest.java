package server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.Socket;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(2);
    }

    @Test
    void idsAreSmallestFreeAndReused() throws Exception {
        assertEquals(1, registry.accept(new Socket(), 0).id());
        assertEquals(2, registry.accept(new Socket(), 0).id());

        assertThrows(ServerFullException.class, () -> registry.accept(new Socket(), 0));

        registry.remove(1);
        assertEquals(1, registry.accept(new Socket(), 0).id());
    }

    @Test
    void unboundedCapacityNeverRejects() throws Exception {
        SessionRegistry unbounded = new SessionRegistry(0);
        for (int i = 1; i <= 10; i++) {
            assertEquals(i, unbounded.accept(new Socket(), 0).id());
        }
        assertEquals(10, unbounded.size());
    }

    @Test
    void removeClosesAndIsIdempotent() throws Exception {
        Socket socket = new Socket();
        Session s = registry.accept(socket, 0);

        assertTrue(registry.remove(s.id()).isPresent());
        assertTrue(socket.isClosed());
        assertFalse(s.isConnected());
        assertTrue(registry.remove(s.id()).isEmpty());
        assertTrue(registry.remove(42).isEmpty());
    }

    @Test
    void closedSessionRefusesNewLines() throws Exception {
        Session s = registry.accept(new Socket(), 0);
        assertTrue(s.offerPriority("{}\n"));

        registry.remove(s.id());

        assertFalse(s.offerPriority("{}\n"));
        assertFalse(s.offerSnapshot("{}\n"));
    }

    @Test
    void sweepRemovesOnlyStaleSessions() throws Exception {
        Session stale = registry.accept(new Socket(), 1_000);
        Session fresh = registry.accept(new Socket(), 1_000);
        registry.touchHeartbeat(fresh.id(), 50_000);
        registry.touchHeartbeat(99, 50_000);   // unknown id is ignored

        assertTrue(registry.sweepTimeouts(61_000, 60_000).isEmpty(), "exactly at the threshold is still alive");

        List<Session> expired = registry.sweepTimeouts(61_001, 60_000);

        assertEquals(List.of(stale), expired);
        assertFalse(registry.contains(stale.id()));
        assertTrue(registry.contains(fresh.id()));
        assertFalse(stale.isConnected());
    }
}
