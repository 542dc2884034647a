package server;

import common.GamePhase;
import common.dto.cmd.ClientCommand;
import common.dto.msg.ConnectionRejectedMsg;
import common.dto.msg.ServerMessage;
import config.ServerConfig;
import model.World;
import net.LineReader;
import net.ProtocolException;
import net.Wire;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.ops.Metrics;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

import javax.net.ServerSocketFactory;

/**
 * Authoritative game server: accept loop, one reader per connection, a fixed-rate
 * simulation loop, a fixed-rate snapshot loop and the one-shot auto-start.
 * All of them meet at the {@link ServerState} monitor.
 */
public final class GameServer {
    private static final Logger log = LoggerFactory.getLogger(GameServer.class);

    private static final int  MAX_LOGGED_LINE   = 200;
    private static final long ACCEPT_BACKOFF_MS = 100;

    private final ServerConfig     config;
    private final LongSupplier     clock;
    private final ServerSocketFactory socketFactory;
    private final Metrics          metrics = new Metrics();
    private final ServerState      state;
    private final SimulationEngine engine;
    private final MessageProcessor processor;
    private final Broadcaster      broadcaster;

    private final ExecutorService          readers       = Executors.newCachedThreadPool(named("Reader", true));
    private final ScheduledExecutorService tickExec      = Executors.newSingleThreadScheduledExecutor(named("SimTick", true));
    private final ScheduledExecutorService broadcastExec = Executors.newSingleThreadScheduledExecutor(named("Broadcast", true));
    private final ScheduledExecutorService opsExec       = Executors.newSingleThreadScheduledExecutor(named("Metrics", true));

    private volatile boolean running = false;
    private volatile boolean stopped = false;
    private ServerSocket serverSocket;
    private Thread acceptThread;

    public GameServer(ServerConfig config) {
        this(config, System::currentTimeMillis, new Random(), ServerSocketFactory.getDefault());
    }

    GameServer(ServerConfig config, LongSupplier clock, Random random, ServerSocketFactory socketFactory) {
        this.config = config;
        this.clock = clock;
        this.socketFactory = socketFactory;
        World world = new World(config.initialDifficulty());
        SessionRegistry sessions = new SessionRegistry(config.maxPlayers());
        this.state = new ServerState(world, sessions, metrics, config.description(), config.maxPlayers());
        this.engine = new SimulationEngine(state, clock, random, config.heartbeatTimeoutSeconds() * 1000L);
        this.processor = new MessageProcessor(state, engine);
        this.broadcaster = new Broadcaster(state);
        metrics.bindSessions(() -> {
            synchronized (state) { return state.sessions.size(); }
        });
    }

    /** Bind the listening socket and start every loop. Returns once the server is accepting. */
    public synchronized void start() throws IOException {
        if (running) return;
        if (stopped) throw new IllegalStateException("server was stopped");

        ServerSocket ss = socketFactory.createServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(config.host(), config.port()));
        serverSocket = ss;
        running = true;

        long tickNanos = 1_000_000_000L / config.tickRateHz();
        long broadcastNanos = 1_000_000_000L / config.broadcastRateHz();
        tickExec.scheduleAtFixedRate(guard("tick", this::tickOnce), tickNanos, tickNanos, TimeUnit.NANOSECONDS);
        tickExec.schedule(guard("auto-start", this::autoStart), config.autoStartDelaySeconds(), TimeUnit.SECONDS);
        broadcastExec.scheduleAtFixedRate(guard("broadcast", this::broadcastOnce),
                broadcastNanos, broadcastNanos, TimeUnit.NANOSECONDS);
        opsExec.scheduleAtFixedRate(() -> log.debug("metrics {}", metrics.snapshotJson()), 5, 5, TimeUnit.SECONDS);

        acceptThread = new Thread(this::acceptLoop, "Acceptor");
        acceptThread.start();

        log.info("Server started on {}:{}", config.host(), ss.getLocalPort());
        log.info("Description: {}", config.description());
        log.info("Maximum players: {}", config.unlimitedCapacity() ? "unlimited (partnership mode)" : config.maxPlayers());
        log.info("Difficulty: {}", config.initialDifficulty());
    }

    /** Stop every loop and close every connection. Safe to call repeatedly. */
    public synchronized void stop() {
        if (stopped) return;
        stopped = true;
        running = false;

        if (serverSocket != null) {
            try { serverSocket.close(); }
            catch (IOException e) { log.warn("Closing listener failed: {}", e.getMessage()); }
        }
        tickExec.shutdownNow();
        broadcastExec.shutdownNow();
        opsExec.shutdownNow();
        synchronized (state) {
            state.closeAll();
        }
        readers.shutdownNow();
        if (acceptThread != null) acceptThread.interrupt();
        log.info("Server stopped");
    }

    public int localPort() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    public boolean isRunning() { return running; }

    public Metrics metrics()   { return metrics; }

    // ======= accept =======

    private void acceptLoop() {
        while (running) {
            Socket s;
            try {
                s = serverSocket.accept();
            } catch (IOException e) {
                if (!running) break;
                log.warn("Accept failed: {}", e.getMessage());
                if (!backOff()) break;
                continue;
            }
            onAccept(s);
        }
    }

    /** Pause after a failed accept, e.g. when out of file descriptors. */
    private static boolean backOff() {
        try {
            Thread.sleep(ACCEPT_BACKOFF_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void onAccept(Socket socket) {
        try {
            socket.setTcpNoDelay(true);
        } catch (SocketException e) {
            log.debug("TCP_NODELAY not applied: {}", e.getMessage());
        }

        List<ServerMessage> events = new ArrayList<>();
        Session session;
        synchronized (state) {
            try {
                session = state.admit(socket, clock.getAsLong(), events);
            } catch (ServerFullException e) {
                session = null;
            }
        }
        if (session == null) {
            reject(socket);
            return;
        }

        try {
            session.startWriterLoop(this::onWriteFailure);
        } catch (IOException e) {
            log.warn("Client {} unusable: {}", session.id(), e.getMessage());
            deliver(events);
            drop(session, DisconnectReason.CONNECTION_LOST);
            return;
        }
        deliver(events);

        final Session bound = session;
        readers.execute(() -> readLoop(bound));
    }

    private void reject(Socket socket) {
        metrics.connectionsRejected.incrementAndGet();
        log.info("Rejected {}: {}", socket.getRemoteSocketAddress(), ServerFullException.REASON);
        try (socket; OutputStream out = socket.getOutputStream()) {
            out.write(Wire.encode(new ConnectionRejectedMsg(ServerFullException.REASON)).getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            log.debug("Rejection not delivered: {}", e.getMessage());
        }
    }

    // ======= per-connection reader =======

    private void readLoop(Session session) {
        DisconnectReason reason = DisconnectReason.CLIENT_CLOSED;
        try (LineReader in = new LineReader(
                new InputStreamReader(session.socket().getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                Optional<ClientCommand> cmd;
                try {
                    cmd = Wire.decode(line.strip());
                } catch (ProtocolException e) {
                    metrics.malformedLines.incrementAndGet();
                    log.warn("Invalid JSON from client {}: {}", session.id(), abbreviate(line));
                    continue;
                }
                cmd.ifPresent(c -> handle(session, c));
            }
        } catch (ProtocolException e) {
            reason = DisconnectReason.PROTOCOL_ERROR;
            metrics.malformedLines.incrementAndGet();
            log.warn("Dropping client {}: {}", session.id(), e.getMessage());
        } catch (IOException e) {
            reason = DisconnectReason.CONNECTION_LOST;
            if (session.isConnected()) log.debug("Read from client {} failed: {}", session.id(), e.getMessage());
        } finally {
            drop(session, reason);
        }
    }

    private void handle(Session session, ClientCommand cmd) {
        List<ServerMessage> events = new ArrayList<>();
        Optional<ServerMessage> reply;
        synchronized (state) {
            if (state.sessions.get(session.id()) != session) return;
            reply = processor.apply(session.id(), cmd, clock.getAsLong(), events);
        }
        reply.ifPresent(r -> NetIO.send(session, r));
        deliver(events);
    }

    // ======= loops =======

    void tickOnce() {
        long startNs = System.nanoTime();
        List<ServerMessage> events = new ArrayList<>();
        synchronized (state) {
            engine.tick(events);
        }
        metrics.observeTickNanos(System.nanoTime() - startNs);
        deliver(events);
    }

    void broadcastOnce() {
        for (Session s : broadcaster.publishSnapshot()) drop(s, DisconnectReason.SEND_FAILED);
    }

    void autoStart() {
        List<ServerMessage> events = new ArrayList<>();
        synchronized (state) {
            if (state.world.getPhase() != GamePhase.MENU || state.world.hasStarted()) return;
            log.info("Auto-starting game");
            engine.startGame(events);
        }
        deliver(events);
    }

    // ======= teardown / fan-out =======

    private void onWriteFailure(Session s) {
        drop(s, DisconnectReason.SEND_FAILED);
    }

    private void drop(Session s, DisconnectReason reason) {
        List<ServerMessage> events = new ArrayList<>();
        synchronized (state) {
            state.release(s, reason, events);
        }
        s.close();
        deliver(events);
    }

    /** Queue events for everyone, then tear down whoever could not take them. */
    private void deliver(List<ServerMessage> events) {
        for (Session failed : broadcaster.publish(events)) drop(failed, DisconnectReason.SEND_FAILED);
    }

    private static Runnable guard(String what, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("{} failed", what, e);
            }
        };
    }

    static ThreadFactory named(String prefix, boolean daemon) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(daemon);
            return t;
        };
    }

    private static String abbreviate(String line) {
        return line.length() <= MAX_LOGGED_LINE ? line : line.substring(0, MAX_LOGGED_LINE) + "...";
    }
}
