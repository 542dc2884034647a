package model;

/**
 * One connected player. The id is the owning session id.
 * Position and flags are written by the owning client, health and score by the simulation.
 */
public final class Player {
    public static final int MAX_HEALTH = 6;

    private final int id;

    // ----- client-driven state -----
    private double  x = World.CENTER_X;
    private double  y = World.CENTER_Y;
    private double  angle;
    private int     character;
    private boolean swordAttacking;
    private boolean speedBoostActive;
    private boolean immunityBoostActive;

    // ----- server-owned state -----
    private int    health    = MAX_HEALTH;
    private final int maxHealth = MAX_HEALTH;
    private int    score;
    private double lastScoreTime;   // game seconds of the last passive score point

    public Player(int id, double lastScoreTime) {
        this.id = id;
        this.lastScoreTime = lastScoreTime;
    }

    /** Back to the spawn point at full health. Score is untouched. */
    public void respawn() {
        x = World.CENTER_X;
        y = World.CENTER_Y;
        health = maxHealth;
    }

    /** Game-start reset. */
    public void resetForNewGame() {
        respawn();
        score = 0;
        swordAttacking = false;
        lastScoreTime = 0;
    }

    /** @return true if this hit took the last point of health */
    public boolean takeHit() {
        health = Math.max(0, health - 1);
        return health == 0;
    }

    public void addScore(int points) { score += points; }

    // ======= getters/setters =======
    public int     getId()                 { return id; }
    public double  getX()                  { return x; }
    public void    setX(double x)          { this.x = x; }
    public double  getY()                  { return y; }
    public void    setY(double y)          { this.y = y; }
    public double  getAngle()              { return angle; }
    public void    setAngle(double angle)  { this.angle = angle; }
    public int     getHealth()             { return health; }
    public void    setHealth(int health)   { this.health = Math.max(0, Math.min(maxHealth, health)); }
    public int     getMaxHealth()          { return maxHealth; }
    public int     getScore()              { return score; }
    public int     getCharacter()          { return character; }
    public void    setCharacter(int c)     { this.character = c; }

    public boolean isSwordAttacking()                 { return swordAttacking; }
    public void    setSwordAttacking(boolean v)       { this.swordAttacking = v; }
    public boolean isSpeedBoostActive()               { return speedBoostActive; }
    public void    setSpeedBoostActive(boolean v)     { this.speedBoostActive = v; }
    public boolean isImmunityBoostActive()            { return immunityBoostActive; }
    public void    setImmunityBoostActive(boolean v)  { this.immunityBoostActive = v; }

    public double  getLastScoreTime()                 { return lastScoreTime; }
    public void    setLastScoreTime(double t)         { this.lastScoreTime = t; }

    public double distanceTo(double ox, double oy) {
        return Math.hypot(x - ox, y - oy);
    }
}
