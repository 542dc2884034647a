package server;

import common.Difficulty;
import common.GamePhase;
import common.dto.cmd.ClientCommand;
import common.dto.cmd.HeartbeatCmd;
import common.dto.cmd.InfoRequestCmd;
import common.dto.cmd.PlayerActionCmd;
import common.dto.cmd.PlayerPatch;
import common.dto.cmd.PlayerUpdateCmd;
import common.dto.cmd.SetDifficultyCmd;
import common.dto.cmd.StartGameCmd;
import common.dto.msg.DifficultyChangedMsg;
import common.dto.msg.ServerMessage;
import common.dto.msg.SwordAttackMsg;
import model.Player;
import model.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Applies one decoded client command. Runs with the {@link ServerState} monitor held.
 * Broadcasts go to {@code events}; a direct reply to the sender is returned.
 */
final class MessageProcessor {
    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    static final int MAX_CHARACTER = 255;

    private final ServerState      state;
    private final SimulationEngine engine;

    MessageProcessor(ServerState state, SimulationEngine engine) {
        this.state = state;
        this.engine = engine;
    }

    Optional<ServerMessage> apply(int sessionId, ClientCommand cmd, long now, List<ServerMessage> events) {
        World world = state.world;

        if (cmd instanceof PlayerUpdateCmd u) {
            Player p = world.player(sessionId);
            if (p != null) applyPatch(p, u.data() == null ? PlayerPatch.EMPTY : u.data());

        } else if (cmd instanceof PlayerActionCmd a) {
            Player p = world.player(sessionId);
            if (p != null && PlayerActionCmd.SWORD_ATTACK.equals(a.action())) {
                // resolved by the next collision pass
                p.setSwordAttacking(true);
                events.add(new SwordAttackMsg(sessionId));
            }

        } else if (cmd instanceof HeartbeatCmd) {
            state.sessions.touchHeartbeat(sessionId, now);

        } else if (cmd instanceof StartGameCmd) {
            if (world.getPhase() == GamePhase.MENU) engine.startGame(events);

        } else if (cmd instanceof SetDifficultyCmd sd) {
            if (sd.difficulty() == null) return Optional.empty();
            Optional<Difficulty> d = Difficulty.fromCode(sd.difficulty());
            if (d.isPresent()) {
                world.setDifficulty(d.get());
                events.add(new DifficultyChangedMsg(d.get()));
                log.info("Client {} set difficulty to {}", sessionId, d.get());
            }

        } else if (cmd instanceof InfoRequestCmd) {
            return Optional.of(state.serverInfo());
        }
        return Optional.empty();
    }

    /** Field-wise merge with range checks; anything out of shape is skipped. */
    static void applyPatch(Player p, PlayerPatch patch) {
        if (finite(patch.x()))     p.setX(clamp(patch.x(), 0, World.WIDTH));
        if (finite(patch.y()))     p.setY(clamp(patch.y(), 0, World.HEIGHT));
        if (finite(patch.angle())) p.setAngle(patch.angle());
        if (patch.health() != null) p.setHealth(patch.health());
        if (patch.character() != null && patch.character() >= 0 && patch.character() <= MAX_CHARACTER) {
            p.setCharacter(patch.character());
        }
        if (patch.swordAttacking() != null)      p.setSwordAttacking(patch.swordAttacking());
        if (patch.speedBoostActive() != null)    p.setSpeedBoostActive(patch.speedBoostActive());
        if (patch.immunityBoostActive() != null) p.setImmunityBoostActive(patch.immunityBoostActive());
    }

    private static boolean finite(Double v) {
        return v != null && Double.isFinite(v);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
