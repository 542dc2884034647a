// server/Session.java
package server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One live connection. Outbound lines go through a per-session writer thread, so a
 * slow peer only ever blocks its own writer: events are queued in order, snapshots
 * are coalesced to the latest one.
 */
final class Session {
    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private static final int  QUEUE_CAPACITY    = 2048;
    private static final long FLUSH_INTERVAL_MS = 33;

    private final int    id;
    private final Socket socket;
    private final String remoteAddress;

    private final BlockingQueue<String>   outQueue       = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final AtomicReference<String> latestSnapshot = new AtomicReference<>(null);

    private volatile boolean connected = true;
    private volatile long    lastHeartbeat;
    private volatile boolean writerRunning = false;
    private Thread writerThread;

    Session(int id, Socket socket, long now) {
        this.id = id;
        this.socket = socket;
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
        this.lastHeartbeat = now;
    }

    int     id()            { return id; }
    Socket  socket()        { return socket; }
    String  remoteAddress() { return remoteAddress; }
    boolean isConnected()   { return connected; }
    long    lastHeartbeat() { return lastHeartbeat; }
    void    touch(long now) { lastHeartbeat = now; }

    /**
     * Start draining queued lines to the socket.
     *
     * @param onFailure called once, from the writer thread, if the socket stops accepting writes
     */
    void startWriterLoop(Consumer<Session> onFailure) throws IOException {
        if (writerRunning) return;
        BufferedWriter out = new BufferedWriter(
                new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        writerRunning = true;
        writerThread = new Thread(() -> writerRun(out, onFailure), "Writer-" + id);
        writerThread.setDaemon(true);
        writerThread.start();
    }

    /** Queue a discrete event. False when the session is already closed. */
    boolean offerPriority(String encodedLine) {
        if (!connected) return false;
        if (!outQueue.offer(encodedLine)) {
            outQueue.poll();
            outQueue.offer(encodedLine);
        }
        return true;
    }

    /** Replace any not-yet-written snapshot. False when the session is already closed. */
    boolean offerSnapshot(String encodedLine) {
        if (!connected) return false;
        latestSnapshot.set(encodedLine);
        return true;
    }

    /** Stop the writer and close the socket. Safe to call more than once. */
    void close() {
        connected = false;
        writerRunning = false;
        if (writerThread != null && writerThread != Thread.currentThread()) writerThread.interrupt();
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("close of session {} failed: {}", id, e.getMessage());
        }
    }

    private void writerRun(BufferedWriter out, Consumer<Session> onFailure) {
        try {
            while (writerRunning) {
                String first = outQueue.poll(FLUSH_INTERVAL_MS, TimeUnit.MILLISECONDS);
                boolean wrote = false;
                if (first != null) {
                    out.write(first);
                    wrote = true;
                    for (int i = 0; i < 1024; i++) {
                        String m = outQueue.poll();
                        if (m == null) break;
                        out.write(m);
                    }
                }
                String snap = latestSnapshot.getAndSet(null);
                if (snap != null) { out.write(snap); wrote = true; }
                if (wrote) out.flush();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (writerRunning) {
                log.warn("Write to client {} failed: {}", id, e.getMessage());
                writerRunning = false;
                onFailure.accept(this);
            }
        }
    }

    @Override
    public String toString() {
        return "Session{" + id + " " + remoteAddress + "}";
    }
}
