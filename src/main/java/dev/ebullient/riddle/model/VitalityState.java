package dev.ebullient.riddle.model;

public enum VitalityState {
    ALIVE(null),
    UNCONSCIOUS("Unconscious"),
    STABLE("Stable"),
    DEAD("Dead"),
    /** Enemy/NPC at 0 hp. Never assigned to a player character. */
    DEFEATED("Defeated");

    private final String condition;

    VitalityState(String condition) {
        this.condition = condition;
    }

    /** The condition name that marks this state on a character, null for ALIVE. */
    public String condition() {
        return condition;
    }

    /** Matches a condition name to a status state, case-insensitively. Null for ordinary conditions. */
    public static VitalityState forCondition(String condition) {
        for (VitalityState state : values()) {
            if (state.condition != null && state.condition.equalsIgnoreCase(condition)) {
                return state;
            }
        }
        return null;
    }
}
