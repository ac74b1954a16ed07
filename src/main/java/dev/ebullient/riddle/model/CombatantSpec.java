package dev.ebullient.riddle.model;

import dev.langchain4j.model.output.structured.Description;

/**
 * A combatant as named by the caller of start_combat or add_combatant.
 * Hit point fields describe a new roster character. For an enemy or NPC
 * already on the roster, a given current hp replaces its hit points.
 * Defeated enemies and NPCs cannot join a combat.
 */
public record CombatantSpec(
        @Description("Character id (roster id for existing characters)") String id,
        @Description("Character name") String name,
        @Description("PC, NPC or Enemy") CharacterType type,
        @Description("Initiative roll") int initiative,
        @Description("Current hit points") Integer currentHp,
        @Description("Maximum hit points") Integer maxHp,
        @Description("True if the combatant is surprised in round 1") boolean surprised) {
}
