package common.dto.cmd;

/**
 * Fields a client may change on its own player. Absent fields are left alone.
 * Id, score and max health belong to the server and are not part of the patch.
 */
public record PlayerPatch(
        Double  x,
        Double  y,
        Double  angle,
        Integer health,
        Integer character,
        Boolean swordAttacking,
        Boolean speedBoostActive,
        Boolean immunityBoostActive
) {
    public static final PlayerPatch EMPTY = new PlayerPatch(null, null, null, null, null, null, null, null);
}
