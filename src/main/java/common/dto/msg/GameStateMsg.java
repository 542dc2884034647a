package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonTypeName;
import common.Difficulty;
import common.GamePhase;
import common.dto.BulletDTO;
import common.dto.ChaserDTO;
import common.dto.PlayerDTO;
import common.dto.PowerupDTO;

import java.util.List;

/** Periodic full snapshot of the world. */
@JsonTypeName("game_state")
public record GameStateMsg(
        GamePhase        state,
        List<PlayerDTO>  players,
        List<ChaserDTO>  chasers,
        List<BulletDTO>  bullets,
        List<PowerupDTO> powerups,
        double           gameTime,
        Difficulty       difficulty,
        int              globalScore
) implements ServerMessage {}
