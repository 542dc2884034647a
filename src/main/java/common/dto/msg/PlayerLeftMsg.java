package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("player_left")
public record PlayerLeftMsg(@JsonProperty("player_id") int playerId) implements ServerMessage {}
