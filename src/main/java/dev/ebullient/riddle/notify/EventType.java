package dev.ebullient.riddle.notify;

public enum EventType {
    COMBAT_STARTED("CombatStarted", EventCategory.COMBAT_LIFECYCLE),
    TURN_ADVANCED("TurnAdvanced", EventCategory.COMBAT_LIFECYCLE),
    COMBATANT_ADDED("CombatantAdded", EventCategory.COMBAT_LIFECYCLE),
    COMBATANT_REMOVED("CombatantRemoved", EventCategory.COMBAT_LIFECYCLE),
    COMBATANT_DEFEATED("CombatantDefeated", EventCategory.COMBAT_LIFECYCLE),
    COMBAT_ENDED("CombatEnded", EventCategory.COMBAT_LIFECYCLE),

    INITIATIVE_SET("InitiativeSet", EventCategory.CHARACTER_STATE),
    CHARACTER_STATE_UPDATED("CharacterStateUpdated", EventCategory.CHARACTER_STATE),

    PLAYER_CHOICE_SUBMITTED("PlayerChoiceSubmitted", EventCategory.PLAYER_CHOICE),
    PLAYER_CHOICES_RECEIVED("PlayerChoicesReceived", EventCategory.DM_CHOICES),

    ATMOSPHERE_PULSE("AtmospherePulseReceived", EventCategory.ATMOSPHERE),
    NARRATIVE_ANCHOR("NarrativeAnchorUpdated", EventCategory.ATMOSPHERE),
    GROUP_INSIGHT("GroupInsightTriggered", EventCategory.ATMOSPHERE),

    PLAYER_ROLL_LOGGED("PlayerRollLogged", EventCategory.TABLE),
    SCENE_IMAGE_UPDATED("SceneImageUpdated", EventCategory.TABLE),

    READ_ALOUD_TEXT("ReadAloudTextReceived", EventCategory.DM_NARRATION),

    PLAYER_CONNECTED("PlayerConnected", EventCategory.PRESENCE),
    PLAYER_DISCONNECTED("PlayerDisconnected", EventCategory.PRESENCE),
    CHARACTER_CLAIMED("CharacterClaimed", EventCategory.PRESENCE),
    CHARACTER_RELEASED("CharacterReleased", EventCategory.PRESENCE);

    private final String eventName;
    private final EventCategory category;

    EventType(String eventName, EventCategory category) {
        this.eventName = eventName;
        this.category = category;
    }

    /** Name clients listen for. */
    public String eventName() {
        return eventName;
    }

    public EventCategory category() {
        return category;
    }
}
