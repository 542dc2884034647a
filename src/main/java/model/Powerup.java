package model;

import common.PowerupType;

// Spawned and broadcast only; nothing consumes powerups yet.
public record Powerup(PowerupType type, int x, int y) {}
