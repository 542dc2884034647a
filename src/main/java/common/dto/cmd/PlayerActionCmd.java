package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("player_action")
public record PlayerActionCmd(@JsonProperty("action") String action) implements ClientCommand {
    public static final String SWORD_ATTACK = "sword_attack";
}
