package common.dto.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("connection_rejected")
public record ConnectionRejectedMsg(@JsonProperty("reason") String reason) implements ServerMessage {}
