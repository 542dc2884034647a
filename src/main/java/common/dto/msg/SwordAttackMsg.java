package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("sword_attack")
public record SwordAttackMsg(@JsonProperty("player_id") int playerId) implements ServerMessage {}
