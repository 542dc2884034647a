package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("start_game")
public record StartGameCmd() implements ClientCommand {}
