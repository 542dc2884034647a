package model;

import common.Difficulty;
import common.GamePhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorldTest {

    private World world;

    @BeforeEach
    void setUp() {
        world = new World(Difficulty.MEDIUM);
    }

    @Test
    void newPlayerSpawnsAtCenterWithFullHealth() {
        Player p = world.addPlayer(1);

        assertEquals(400, p.getX());
        assertEquals(300, p.getY());
        assertEquals(Player.MAX_HEALTH, p.getHealth());
        assertEquals(6, p.getMaxHealth());
        assertEquals(0, p.getScore());
        assertSame(p, world.player(1));
    }

    @Test
    void duplicatePlayerIdIsRefused() {
        world.addPlayer(1);
        assertThrows(IllegalStateException.class, () -> world.addPlayer(1));
    }

    @Test
    void activeChaserIdsStayUnique() {
        world.addChaser(new Chaser(0, 100, 100, 1.0));
        assertThrows(IllegalStateException.class, () -> world.addChaser(new Chaser(0, 200, 200, 1.0)));
    }

    @Test
    void nearestPlayerPicksSmallestDistance() {
        world.addPlayer(1).setX(100);
        Player near = world.addPlayer(2);
        near.setX(390);

        assertSame(near, world.nearestPlayer(380, 300));
        assertNull(new World(Difficulty.EASY).nearestPlayer(0, 0));
    }

    @Test
    void resetForNewGameClearsScoresAndSchedules() {
        Player p = world.addPlayer(1);
        p.setX(10);
        p.setHealth(2);
        p.addScore(40);
        p.setSwordAttacking(true);
        world.addGlobalScore(9);
        world.advanceGameTime(33);
        world.markDamaged(1, 5_000);
        world.chaserRespawns().put(0, 35.0);
        world.addChaser(new Chaser(1, 100, 100, 1.0));

        world.resetForNewGame();

        assertEquals(GamePhase.PLAYING, world.getPhase());
        assertTrue(world.hasStarted());
        assertEquals(0, world.getGameTime());
        assertEquals(0, world.getGlobalScore());
        assertNull(world.lastDamageAt(1));
        assertTrue(world.chaserRespawns().isEmpty());
        assertTrue(world.chasers().isEmpty());
        assertEquals(400, p.getX());
        assertEquals(6, p.getHealth());
        assertEquals(0, p.getScore());
        assertFalse(p.isSwordAttacking());
    }

    @Test
    void removingPlayerForgetsDamageCooldown() {
        world.addPlayer(3);
        world.markDamaged(3, 1_000);

        world.removePlayer(3);
        world.addPlayer(3);

        assertNull(world.lastDamageAt(3));
    }

    @Test
    void bulletLeavingPlayfieldIsOutOfBounds() {
        Bullet b = new Bullet(798, 300, 5, 0);
        assertFalse(b.isOutOfBounds());
        b.advance();
        assertTrue(b.isOutOfBounds());
    }
}
