package common.dto;

public record PlayerDTO(
        int     id,
        double  x, double y,
        double  angle,
        int     health,
        int     maxHealth,
        int     score,
        int     character,
        boolean swordAttacking,
        boolean speedBoostActive,
        boolean immunityBoostActive
) {}
