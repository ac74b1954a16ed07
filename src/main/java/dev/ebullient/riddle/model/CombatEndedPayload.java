package dev.ebullient.riddle.model;

public record CombatEndedPayload(
        long version,
        String combatId,
        String reason) {

    public static final String ENDED_BY_DM = "ended";
    public static final String ALL_ENEMIES_DEFEATED = "all_enemies_defeated";
}
