package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonTypeName;
import common.dto.PlayerDTO;

@JsonTypeName("player_respawned")
public record PlayerRespawnedMsg(int playerId, PlayerDTO playerData) implements ServerMessage {}
