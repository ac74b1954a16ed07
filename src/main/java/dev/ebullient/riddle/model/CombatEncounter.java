package dev.ebullient.riddle.model;

import java.util.List;

/**
 * An active combat. Turn order holds character ids only; everything else about
 * a combatant is read from the campaign roster.
 */
public record CombatEncounter(
        String id,
        boolean active,
        int roundNumber,
        List<String> turnOrder,
        int currentTurnIndex,
        List<String> surprisedEntities,
        List<String> defeated) {

    public CombatEncounter {
        if (roundNumber < 1) {
            throw new IllegalArgumentException("Round number must be >= 1, got " + roundNumber);
        }
        turnOrder = turnOrder == null ? List.of() : List.copyOf(turnOrder);
        surprisedEntities = surprisedEntities == null ? List.of() : List.copyOf(surprisedEntities);
        defeated = defeated == null ? List.of() : List.copyOf(defeated);
        if (turnOrder.isEmpty() ? currentTurnIndex != 0 : currentTurnIndex < 0 || currentTurnIndex >= turnOrder.size()) {
            throw new IllegalArgumentException("Turn index " + currentTurnIndex
                    + " out of range for " + turnOrder.size() + " combatants");
        }
    }

    /** Id of the combatant whose turn it is, or null when nobody is left in the turn order. */
    public String currentCombatantId() {
        return turnOrder.isEmpty() ? null : turnOrder.get(currentTurnIndex);
    }

    public boolean inTurnOrder(String characterId) {
        return turnOrder.contains(characterId);
    }

    public boolean isSurprised(String characterId) {
        return surprisedEntities.contains(characterId);
    }
}
