// common/dto/cmd/ClientCommand.java
package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlayerUpdateCmd.class,  name = "player_update"),
        @JsonSubTypes.Type(value = PlayerActionCmd.class,  name = "player_action"),
        @JsonSubTypes.Type(value = HeartbeatCmd.class,     name = "heartbeat"),
        @JsonSubTypes.Type(value = StartGameCmd.class,     name = "start_game"),
        @JsonSubTypes.Type(value = SetDifficultyCmd.class, name = "set_difficulty"),
        @JsonSubTypes.Type(value = InfoRequestCmd.class,   name = "info_request"),
})
public interface ClientCommand {}
