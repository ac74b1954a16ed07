package dev.ebullient.riddle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CharacterType {
    PC("PC"),
    NPC("NPC"),
    ENEMY("Enemy");

    private final String display;

    CharacterType(String display) {
        this.display = display;
    }

    @JsonValue
    public String display() {
        return display;
    }

    /** Player characters make death saves; everything else is defeated at 0 hp. */
    public boolean isPlayer() {
        return this == PC;
    }

    @JsonCreator
    public static CharacterType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (CharacterType type : values()) {
            if (type.display.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown character type: " + value);
    }
}
