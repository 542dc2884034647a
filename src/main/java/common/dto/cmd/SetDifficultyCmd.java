package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("set_difficulty")
public record SetDifficultyCmd(@JsonProperty("difficulty") Integer difficulty) implements ClientCommand {}
