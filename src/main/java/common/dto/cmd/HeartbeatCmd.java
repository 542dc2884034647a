package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("heartbeat")
public record HeartbeatCmd() implements ClientCommand {}
