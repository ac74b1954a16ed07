package dev.ebullient.riddle.model;

import java.util.List;

/**
 * The combat as receivers see it. {@code turnOrder} holds the combatants still
 * fighting; enemies and NPCs defeated in this encounter are listed in
 * {@code defeated}, flagged as such.
 */
public record CombatStatePayload(
        long version,
        String combatId,
        boolean active,
        int roundNumber,
        List<CombatantView> turnOrder,
        int currentTurnIndex,
        String currentCombatantId,
        List<CombatantView> defeated) {
}
