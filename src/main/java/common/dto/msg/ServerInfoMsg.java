package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonTypeName;
import common.Difficulty;

/** Server-browser ping reply. */
@JsonTypeName("server_info")
public record ServerInfoMsg(String description, int maxPlayers, Difficulty difficulty) implements ServerMessage {}
