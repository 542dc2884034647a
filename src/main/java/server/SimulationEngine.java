package server;

import common.Difficulty;
import common.GamePhase;
import common.PowerupType;
import common.dto.msg.GameStartedMsg;
import common.dto.msg.PlayerRespawnedMsg;
import common.dto.msg.ServerMessage;
import mapper.Mapper;
import model.Bullet;
import model.Chaser;
import model.Player;
import model.Powerup;
import model.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Fixed-tick rules of the shared world.
 * <p>
 * Every method runs with the {@link ServerState} monitor held. Within a tick the
 * order is fixed: chaser movement, chaser fire, bullet motion, bullet hits, sword
 * hits, powerup spawn, chaser respawns, passive scoring.
 */
final class SimulationEngine {
    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    static final double LIGHT_RADIUS          = 128;
    static final double FIRE_RANGE            = 400;
    static final double BULLET_HIT_RADIUS     = 20;
    static final double SWORD_RADIUS          = 80;
    static final long   DAMAGE_COOLDOWN_MS    = 1_000;    // wall clock
    static final double CHASER_RESPAWN_DELAY  = 2.0;      // game seconds
    static final double SCORE_INTERVAL        = 10.0;     // game seconds
    static final int    SWORD_KILL_POINTS     = 5;
    static final double POWERUP_CHANCE        = 0.001;    // per tick

    // chaser spawn sampling
    static final int    SPAWN_MARGIN          = 100;
    static final double SPAWN_MIN_FROM_CENTER = 200;
    static final int    SPAWN_ATTEMPTS        = 50;

    // powerup placement (inclusive)
    static final int POWERUP_MIN_X = 50, POWERUP_MAX_X = 750;
    static final int POWERUP_MIN_Y = 50, POWERUP_MAX_Y = 550;

    private final ServerState  state;
    private final World        world;
    private final LongSupplier clock;
    private final Random       random;
    private final long         heartbeatTimeoutMs;

    private long lastTickMs;

    SimulationEngine(ServerState state, LongSupplier clock, Random random, long heartbeatTimeoutMs) {
        this.state = state;
        this.world = state.world;
        this.clock = clock;
        this.random = random;
        this.heartbeatTimeoutMs = heartbeatTimeoutMs;
        this.lastTickMs = clock.getAsLong();
    }

    /**
     * One scheduled tick: timeout housekeeping always, world rules only while PLAYING.
     * The game-time step is the measured wall-clock delta since the previous tick.
     */
    void tick(List<ServerMessage> events) {
        long now = clock.getAsLong();
        double dt = (now - lastTickMs) / 1000.0;
        lastTickMs = now;

        state.expire(now, heartbeatTimeoutMs, events);

        if (world.getPhase() == GamePhase.PLAYING) {
            step(dt, now, events);
        }
    }

    void step(double dt, long nowMs, List<ServerMessage> events) {
        world.advanceGameTime(dt);
        moveChasers();
        fireChasers();
        moveBullets();
        resolveBulletHits(nowMs, events);
        resolveSwordHits();
        maybeSpawnPowerup();
        respawnDueChasers();
        awardPassiveScores();
    }

    /** Reset the world and put the full chaser set on the field. */
    void startGame(List<ServerMessage> events) {
        world.resetForNewGame();
        Difficulty d = world.getDifficulty();
        for (int id = 0; id < d.chaserCount(); id++) {
            world.addChaser(spawnChaser(id));
        }
        events.add(new GameStartedMsg(d));
        log.info("Game started: difficulty={} chasers={}", d, d.chaserCount());
    }

    // ======= per-tick steps =======

    void moveChasers() {
        if (!world.hasPlayers()) return;
        for (Chaser c : world.chasers()) {
            Player target = world.nearestPlayer(c.getX(), c.getY());
            if (target == null) continue;
            if (target.distanceTo(c.getX(), c.getY()) < LIGHT_RADIUS) continue;   // lit: frozen
            c.stepToward(target.getX(), target.getY());
        }
    }

    void fireChasers() {
        double now = world.getGameTime();
        Difficulty d = world.getDifficulty();
        if (now - world.getLastBulletTime() < d.bulletIntervalSeconds()) return;

        for (Chaser c : world.chasers()) {
            Player target = world.nearestPlayer(c.getX(), c.getY());
            if (target == null) continue;
            double dist = target.distanceTo(c.getX(), c.getY());
            if (dist >= FIRE_RANGE || dist < LIGHT_RADIUS) continue;

            double ux = (target.getX() - c.getX()) / dist;
            double uy = (target.getY() - c.getY()) / dist;
            world.bullets().add(new Bullet(c.getX(), c.getY(), ux * d.bulletSpeed(), uy * d.bulletSpeed()));
            state.metrics.bulletsFired.incrementAndGet();
        }
        world.setLastBulletTime(now);
    }

    void moveBullets() {
        world.bullets().removeIf(b -> {
            b.advance();
            return b.isOutOfBounds();
        });
    }

    /** Each player consumes at most one bullet per tick, damaged or not. */
    void resolveBulletHits(long nowMs, List<ServerMessage> events) {
        List<Bullet> bullets = world.bullets();
        for (Player p : world.players()) {
            for (Iterator<Bullet> it = bullets.iterator(); it.hasNext(); ) {
                Bullet b = it.next();
                if (p.distanceTo(b.getX(), b.getY()) >= BULLET_HIT_RADIUS) continue;

                if (!p.isImmunityBoostActive() && cooledDown(p.getId(), nowMs)) {
                    world.markDamaged(p.getId(), nowMs);
                    if (p.takeHit()) killAndRespawn(p, events);
                }
                it.remove();
                break;
            }
        }
    }

    /** One kill per attacking player per tick; the attack flag stays set if nothing was in reach. */
    void resolveSwordHits() {
        for (Player p : world.players()) {
            if (!p.isSwordAttacking()) continue;
            for (Iterator<Chaser> it = world.chasers().iterator(); it.hasNext(); ) {
                Chaser c = it.next();
                if (p.distanceTo(c.getX(), c.getY()) >= SWORD_RADIUS) continue;

                it.remove();
                world.chaserRespawns().put(c.getId(), world.getGameTime() + CHASER_RESPAWN_DELAY);
                p.addScore(SWORD_KILL_POINTS);
                world.addGlobalScore(SWORD_KILL_POINTS);
                p.setSwordAttacking(false);
                state.metrics.chasersSlain.incrementAndGet();
                log.debug("Player {} slew chaser {}", p.getId(), c.getId());
                break;
            }
        }
    }

    void maybeSpawnPowerup() {
        if (random.nextDouble() >= POWERUP_CHANCE) return;
        PowerupType[] types = PowerupType.values();
        world.powerups().add(new Powerup(
                types[random.nextInt(types.length)],
                randInclusive(POWERUP_MIN_X, POWERUP_MAX_X),
                randInclusive(POWERUP_MIN_Y, POWERUP_MAX_Y)));
    }

    void respawnDueChasers() {
        double now = world.getGameTime();
        List<Integer> due = new ArrayList<>();
        for (Map.Entry<Integer, Double> e : world.chaserRespawns().entrySet()) {
            if (now >= e.getValue()) due.add(e.getKey());
        }
        for (int id : due) {
            world.chaserRespawns().remove(id);
            if (world.chaser(id) == null) world.addChaser(spawnChaser(id));
        }
    }

    void awardPassiveScores() {
        double now = world.getGameTime();
        for (Player p : world.players()) {
            if (now - p.getLastScoreTime() >= SCORE_INTERVAL) {
                p.addScore(1);
                p.setLastScoreTime(now);
            }
        }
        if (now - world.getLastGlobalScoreTime() >= SCORE_INTERVAL) {
            world.addGlobalScore(1);
            world.setLastGlobalScoreTime(now);
        }
    }

    // ======= helpers =======

    /**
     * Random point away from the spawn centre: up to {@link #SPAWN_ATTEMPTS} samples,
     * keeping the last one if none is far enough.
     */
    Chaser spawnChaser(int id) {
        int x = 0, y = 0;
        for (int attempt = 0; attempt < SPAWN_ATTEMPTS; attempt++) {
            x = randInclusive(SPAWN_MARGIN, (int) World.WIDTH - SPAWN_MARGIN);
            y = randInclusive(SPAWN_MARGIN, (int) World.HEIGHT - SPAWN_MARGIN);
            if (Math.hypot(x - World.CENTER_X, y - World.CENTER_Y) >= SPAWN_MIN_FROM_CENTER) break;
        }
        return new Chaser(id, x, y, world.getDifficulty().chaserSpeed());
    }

    private boolean cooledDown(int playerId, long nowMs) {
        Long last = world.lastDamageAt(playerId);
        return last == null || nowMs - last >= DAMAGE_COOLDOWN_MS;
    }

    private void killAndRespawn(Player p, List<ServerMessage> events) {
        p.respawn();
        state.metrics.playerDeaths.incrementAndGet();
        events.add(new PlayerRespawnedMsg(p.getId(), Mapper.toPlayerDTO(p)));
        log.info("Player {} died and respawned", p.getId());
    }

    private int randInclusive(int lo, int hi) {
        return lo + random.nextInt(hi - lo + 1);
    }
}
