package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonTypeName;
import common.Difficulty;
import common.GamePhase;

/** Welcome line, always the first thing an admitted client reads. */
@JsonTypeName("connected")
public record ConnectedMsg(int clientId,
                           int maxPlayers,
                           int currentPlayers,
                           GamePhase gameState,
                           String serverDescription,
                           Difficulty difficulty) implements ServerMessage {}
