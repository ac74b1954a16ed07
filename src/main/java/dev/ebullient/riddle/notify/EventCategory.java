package dev.ebullient.riddle.notify;

public enum EventCategory {
    /** Combat started, turn or round advanced, combatants added/removed/defeated, combat ended. */
    COMBAT_LIFECYCLE,
    /** Hit points, conditions, death saves, initiative. */
    CHARACTER_STATE,
    /** A player submitted a choice. */
    PLAYER_CHOICE,
    /** The DM presented a list of choices. */
    DM_CHOICES,
    /** Pulse, narrative anchor, group insight. */
    ATMOSPHERE,
    /** Dice rolls and the scene image, shown on every screen. */
    TABLE,
    /** Text for the DM to read aloud. */
    DM_NARRATION,
    /** Player connections opening and closing, characters claimed and released. */
    PRESENCE
}
