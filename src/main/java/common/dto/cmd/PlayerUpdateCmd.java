package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("player_update")
public record PlayerUpdateCmd(@JsonProperty("data") PlayerPatch data) implements ClientCommand {}
