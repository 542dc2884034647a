package common;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whole-server game phase; only PLAYING advances the simulation. */
public enum GamePhase {
    MENU(1), PLAYING(2), PAUSED(3), GAME_OVER(4);

    private final int code;

    GamePhase(int code) { this.code = code; }

    @JsonValue
    public int code() { return code; }
}
