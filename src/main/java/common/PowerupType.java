package common;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PowerupType {
    HEALTH("health"), SPEED("speed"), IMMUNITY("immunity");

    private final String wireName;

    PowerupType(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }
}
