// mapper/Mapper.java
package mapper;

import common.dto.BulletDTO;
import common.dto.ChaserDTO;
import common.dto.PlayerDTO;
import common.dto.PowerupDTO;
import common.dto.msg.GameStateMsg;
import model.Bullet;
import model.Chaser;
import model.Player;
import model.Powerup;
import model.World;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Model to wire DTOs. Callers hold the world's monitor. */
public final class Mapper {
    private Mapper() {}

    /* ------------ public API ------------ */
    public static GameStateMsg toGameState(World w) {
        return new GameStateMsg(
                w.getPhase(),
                toPlayerDTOs(w.players()),
                toChaserDTOs(w.chasers()),
                toBulletDTOs(w.bullets()),
                toPowerupDTOs(w.powerups()),
                w.getGameTime(),
                w.getDifficulty(),
                w.getGlobalScore());
    }

    public static PlayerDTO toPlayerDTO(Player p) {
        return new PlayerDTO(
                p.getId(),
                p.getX(), p.getY(),
                p.getAngle(),
                p.getHealth(),
                p.getMaxHealth(),
                p.getScore(),
                p.getCharacter(),
                p.isSwordAttacking(),
                p.isSpeedBoostActive(),
                p.isImmunityBoostActive());
    }

    public static List<PlayerDTO> toPlayerDTOs(Collection<Player> ps) {
        var out = new ArrayList<PlayerDTO>(ps.size());
        for (Player p : ps) out.add(toPlayerDTO(p));
        return out;
    }

    public static List<ChaserDTO> toChaserDTOs(List<Chaser> cs) {
        var out = new ArrayList<ChaserDTO>(cs.size());
        for (Chaser c : cs) {
            out.add(new ChaserDTO(c.getId(), c.getX(), c.getY(), c.getAngle(), c.getSpeed(), c.getHealth()));
        }
        return out;
    }

    public static List<BulletDTO> toBulletDTOs(List<Bullet> bs) {
        var out = new ArrayList<BulletDTO>(bs.size());
        for (Bullet b : bs) out.add(new BulletDTO(b.getX(), b.getY(), b.getDx(), b.getDy()));
        return out;
    }

    public static List<PowerupDTO> toPowerupDTOs(List<Powerup> ps) {
        var out = new ArrayList<PowerupDTO>(ps.size());
        for (Powerup p : ps) out.add(new PowerupDTO(p.type(), p.x(), p.y()));
        return out;
    }
}
