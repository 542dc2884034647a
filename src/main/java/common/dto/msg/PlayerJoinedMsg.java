package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonTypeName;
import common.dto.PlayerDTO;

@JsonTypeName("player_joined")
public record PlayerJoinedMsg(int playerId, PlayerDTO playerData) implements ServerMessage {}
