package model;

import common.Difficulty;
import common.GamePhase;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The shared, authoritative game model.
 * <p>
 * Not thread-safe. Every read and write goes through the server's single monitor.
 */
public final class World {
    public static final double WIDTH    = 800;
    public static final double HEIGHT   = 600;
    public static final double CENTER_X = 400;
    public static final double CENTER_Y = 300;

    // ----- entities -----
    private final Map<Integer, Player> players = new TreeMap<>();   // iteration in id order
    private final List<Chaser>  chasers  = new ArrayList<>();
    private final List<Bullet>  bullets  = new ArrayList<>();
    private final List<Powerup> powerups = new ArrayList<>();

    // ----- timers / schedules -----
    private final Map<Integer, Double> chaserRespawns  = new TreeMap<>();  // chaser id -> game time
    private final Map<Integer, Long>   damageCooldowns = new HashMap<>();  // player id -> wall ms
    private double gameTime;
    private double lastBulletTime;
    private double lastGlobalScoreTime;

    // ----- scalars -----
    private GamePhase  phase = GamePhase.MENU;
    private Difficulty difficulty;
    private int        globalScore;
    private boolean    started;   // a game has been started at least once

    public World(Difficulty difficulty) {
        this.difficulty = difficulty;
    }

    // ======= players =======

    /** New player at the spawn point; its passive score clock starts now. */
    public Player addPlayer(int id) {
        if (players.containsKey(id)) throw new IllegalStateException("player " + id + " already exists");
        Player p = new Player(id, gameTime);
        players.put(id, p);
        return p;
    }

    public Player removePlayer(int id) {
        damageCooldowns.remove(id);
        return players.remove(id);
    }

    public Player player(int id)              { return players.get(id); }
    public Collection<Player> players()       { return Collections.unmodifiableCollection(players.values()); }
    public boolean hasPlayers()               { return !players.isEmpty(); }

    /** Nearest player by Euclidean distance, or null when the world is empty. */
    public Player nearestPlayer(double x, double y) {
        Player best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (Player p : players.values()) {
            double d = p.distanceTo(x, y);
            if (d < bestDist) { bestDist = d; best = p; }
        }
        return best;
    }

    // ======= chasers =======

    public List<Chaser> chasers() { return chasers; }

    public Chaser chaser(int id) {
        for (Chaser c : chasers) if (c.getId() == id) return c;
        return null;
    }

    public void addChaser(Chaser c) {
        if (chaser(c.getId()) != null) throw new IllegalStateException("chaser " + c.getId() + " already active");
        chasers.add(c);
    }

    public Map<Integer, Double> chaserRespawns() { return chaserRespawns; }

    // ======= projectiles / pickups =======

    public List<Bullet>  bullets()  { return bullets; }
    public List<Powerup> powerups() { return powerups; }

    // ======= cooldowns =======

    public Long lastDamageAt(int playerId)              { return damageCooldowns.get(playerId); }
    public void markDamaged(int playerId, long wallMs)  { damageCooldowns.put(playerId, wallMs); }

    // ======= lifecycle =======

    /**
     * Clears everything a new game starts from. Chasers are re-spawned by the engine;
     * bullets and powerups already on the field stay.
     */
    public void resetForNewGame() {
        phase = GamePhase.PLAYING;
        started = true;
        gameTime = 0;
        lastBulletTime = 0;
        lastGlobalScoreTime = 0;
        globalScore = 0;
        damageCooldowns.clear();
        chaserRespawns.clear();
        chasers.clear();
        for (Player p : players.values()) p.resetForNewGame();
    }

    // ======= scalars =======

    public GamePhase  getPhase()                    { return phase; }
    public void       setPhase(GamePhase phase)     { this.phase = phase; }
    public Difficulty getDifficulty()               { return difficulty; }
    public void       setDifficulty(Difficulty d)   { this.difficulty = d; }
    public boolean    hasStarted()                  { return started; }

    public double getGameTime()                     { return gameTime; }
    public void   advanceGameTime(double dt)        { gameTime += dt; }

    public double getLastBulletTime()               { return lastBulletTime; }
    public void   setLastBulletTime(double t)       { lastBulletTime = t; }

    public int    getGlobalScore()                  { return globalScore; }
    public void   addGlobalScore(int points)        { globalScore += points; }
    public double getLastGlobalScoreTime()          { return lastGlobalScoreTime; }
    public void   setLastGlobalScoreTime(double t)  { lastGlobalScoreTime = t; }
}
