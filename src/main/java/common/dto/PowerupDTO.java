package common.dto;

import common.PowerupType;

public record PowerupDTO(PowerupType type, int x, int y) {}
