package common;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Difficulty table. Each level fixes the chaser pool size and speed plus the
 * shared bullet cadence and bullet speed.
 * <p>
 * Fewer chasers move faster: EASY has one fast chaser, HARD three slow ones.
 */
public enum Difficulty {
    //      code chasers chaserSpeed bulletInterval bulletSpeed
    EASY(   1,   1,      2.0,        3.0,           3.0),
    MEDIUM( 2,   2,      1.0,        2.0,           5.0),
    HARD(   3,   3,      0.5,        1.0,           7.0);

    private final int    code;
    private final int    chaserCount;
    private final double chaserSpeed;
    private final double bulletIntervalSeconds;
    private final double bulletSpeed;

    Difficulty(int code, int chaserCount, double chaserSpeed, double bulletIntervalSeconds, double bulletSpeed) {
        this.code = code;
        this.chaserCount = chaserCount;
        this.chaserSpeed = chaserSpeed;
        this.bulletIntervalSeconds = bulletIntervalSeconds;
        this.bulletSpeed = bulletSpeed;
    }

    @JsonValue
    public int code()                     { return code; }
    public int chaserCount()              { return chaserCount; }
    public double chaserSpeed()           { return chaserSpeed; }
    public double bulletIntervalSeconds() { return bulletIntervalSeconds; }
    public double bulletSpeed()           { return bulletSpeed; }

    /** Wire lookup; empty for anything that is not 1, 2 or 3. */
    public static Optional<Difficulty> fromCode(int code) {
        for (Difficulty d : values()) {
            if (d.code == code) return Optional.of(d);
        }
        return Optional.empty();
    }

    /** Config lookup by name, case-insensitive. */
    public static Difficulty fromName(String name, Difficulty fallback) {
        if (name == null || name.isBlank()) return fallback;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
