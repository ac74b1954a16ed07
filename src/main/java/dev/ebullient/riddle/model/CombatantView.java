package dev.ebullient.riddle.model;

import java.util.List;

/** A combatant as receivers see it: roster fields plus combat-only flags. */
public record CombatantView(
        String id,
        String name,
        CharacterType type,
        int initiative,
        int currentHp,
        int maxHp,
        int temporaryHp,
        List<String> conditions,
        VitalityState state,
        boolean defeated,
        boolean surprised) {

    public static CombatantView of(Character c, CombatEncounter combat) {
        return new CombatantView(c.id(), c.name(), c.type(), c.initiative(),
                c.currentHp(), c.maxHp(), c.temporaryHp(), c.conditions(), c.vitality(),
                combat.defeated().contains(c.id()),
                combat.isSurprised(c.id()));
    }
}
