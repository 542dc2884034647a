package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import common.Difficulty;

@JsonTypeName("difficulty_changed")
public record DifficultyChangedMsg(@JsonProperty("difficulty") Difficulty difficulty) implements ServerMessage {}
