// common/dto/msg/ServerMessage.java
package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Everything the server writes to a client. The subtype name becomes the
 * {@code type} property of the JSON line.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConnectedMsg.class,          name = "connected"),
        @JsonSubTypes.Type(value = ConnectionRejectedMsg.class, name = "connection_rejected"),
        @JsonSubTypes.Type(value = ServerInfoMsg.class,         name = "server_info"),
        @JsonSubTypes.Type(value = PlayerJoinedMsg.class,       name = "player_joined"),
        @JsonSubTypes.Type(value = PlayerLeftMsg.class,         name = "player_left"),
        @JsonSubTypes.Type(value = PlayerRespawnedMsg.class,    name = "player_respawned"),
        @JsonSubTypes.Type(value = GameStartedMsg.class,        name = "game_started"),
        @JsonSubTypes.Type(value = DifficultyChangedMsg.class,  name = "difficulty_changed"),
        @JsonSubTypes.Type(value = SwordAttackMsg.class,        name = "sword_attack"),
        @JsonSubTypes.Type(value = GameStateMsg.class,          name = "game_state"),
})
public interface ServerMessage {}
