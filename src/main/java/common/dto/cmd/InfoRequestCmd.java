package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("info_request")
public record InfoRequestCmd() implements ClientCommand {}
