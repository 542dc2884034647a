package model;

/** AI pursuer. The id survives respawns; a slain chaser is absent until it comes back. */
public final class Chaser {
    private final int id;
    private double x, y;
    private double angle;
    private final double speed;
    private final int health = 1;

    public Chaser(int id, double x, double y, double speed) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.speed = speed;
    }

    /** Step {@code speed} units toward the target and face it. */
    public void stepToward(double tx, double ty) {
        double dx = tx - x, dy = ty - y;
        double dist = Math.hypot(dx, dy);
        if (dist <= 0) return;
        dx /= dist;
        dy /= dist;
        x += dx * speed;
        y += dy * speed;
        angle = Math.toDegrees(Math.atan2(dy, dx));
    }

    public int    getId()     { return id; }
    public double getX()      { return x; }
    public double getY()      { return y; }
    public double getAngle()  { return angle; }
    public double getSpeed()  { return speed; }
    public int    getHealth() { return health; }
}
