package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import common.Difficulty;

@JsonTypeName("game_started")
public record GameStartedMsg(@JsonProperty("difficulty") Difficulty difficulty) implements ServerMessage {}
