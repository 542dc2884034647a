package model;

/** Chaser projectile with a fixed per-tick velocity. */
public final class Bullet {
    private double x, y;
    private final double dx, dy;

    public Bullet(double x, double y, double dx, double dy) {
        this.x = x; this.y = y;
        this.dx = dx; this.dy = dy;
    }

    public void advance() {
        x += dx;
        y += dy;
    }

    public boolean isOutOfBounds() {
        return x < 0 || x > World.WIDTH || y < 0 || y > World.HEIGHT;
    }

    public double getX()  { return x; }
    public double getY()  { return y; }
    public double getDx() { return dx; }
    public double getDy() { return dy; }
}
