package dev.ebullient.riddle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.riddle.model.Character;
import dev.ebullient.riddle.model.CombatEncounter;

/**
 * Turn order for one encounter: sorting by initiative, the round/turn
 * pointers and removal of combatants. Works on immutable encounters and
 * returns the next one.
 */
@Singleton
public class TurnOrderManager {
    private static final Logger log = Logger.getLogger(TurnOrderManager.class);

    /** Result of defeating a combatant; {@code encounter} is null when combat ended. */
    public record Defeat(CombatEncounter encounter, boolean combatEnded) {
    }

    /**
     * Build a new encounter ordered by descending initiative. Ties keep the
     * order the combatants were given in.
     */
    public CombatEncounter start(List<Character> combatants, Collection<String> surprised) {
        if (combatants == null || combatants.isEmpty()) {
            throw GameStateException.validation("Combat needs at least one combatant");
        }
        List<Character> sorted = new ArrayList<>(combatants);
        sorted.sort(Comparator.comparingInt(Character::initiative).reversed());

        Set<String> ids = new LinkedHashSet<>();
        for (Character c : sorted) {
            if (!ids.add(c.id())) {
                throw GameStateException.validation("Combatant listed twice: " + c.name());
            }
        }
        List<String> surprisedIds = surprised == null
                ? List.of()
                : surprised.stream().filter(ids::contains).distinct().toList();

        CombatEncounter encounter = new CombatEncounter(UUID.randomUUID().toString(), true, 1,
                List.copyOf(ids), 0, surprisedIds, List.of());
        log.debugf("New turn order %s (surprised: %s)", encounter.turnOrder(), surprisedIds);
        return encounter;
    }

    /**
     * Re-sort after an initiative change. The turn pointer is re-anchored so it
     * still refers to the combatant whose turn it was before the sort.
     */
    public CombatEncounter reorder(CombatEncounter encounter, ToIntFunction<String> initiativeOf) {
        String current = encounter.currentCombatantId();
        List<String> order = new ArrayList<>(encounter.turnOrder());
        order.sort(Comparator.comparingInt(initiativeOf).reversed());
        int index = current == null ? 0 : order.indexOf(current);
        return new CombatEncounter(encounter.id(), encounter.active(), encounter.roundNumber(),
                order, index, encounter.surprisedEntities(), encounter.defeated());
    }

    /**
     * Move to the next combatant. Wrapping past the last one starts a new round
     * and clears surprise.
     */
    public CombatEncounter advance(CombatEncounter encounter) {
        if (encounter.turnOrder().isEmpty()) {
            throw GameStateException.invalidState("No combatants in turn order");
        }
        int next = encounter.currentTurnIndex() + 1;
        if (next < encounter.turnOrder().size()) {
            return new CombatEncounter(encounter.id(), encounter.active(), encounter.roundNumber(),
                    encounter.turnOrder(), next, encounter.surprisedEntities(), encounter.defeated());
        }
        return new CombatEncounter(encounter.id(), encounter.active(), encounter.roundNumber() + 1,
                encounter.turnOrder(), 0, List.of(), encounter.defeated());
    }

    /**
     * Insert a combatant after everyone with the same or higher initiative.
     * The turn pointer keeps referring to the same combatant.
     */
    public CombatEncounter add(CombatEncounter encounter, String characterId, ToIntFunction<String> initiativeOf) {
        if (encounter.inTurnOrder(characterId)) {
            throw GameStateException.invalidState("Already in the turn order: " + characterId);
        }
        List<String> order = new ArrayList<>(encounter.turnOrder());
        int initiative = initiativeOf.applyAsInt(characterId);
        int insertAt = order.size();
        for (int i = 0; i < order.size(); i++) {
            if (initiativeOf.applyAsInt(order.get(i)) < initiative) {
                insertAt = i;
                break;
            }
        }
        order.add(insertAt, characterId);
        int current = encounter.currentTurnIndex();
        if (order.size() > 1 && insertAt <= current) {
            current++;
        }
        List<String> defeated = encounter.defeated().stream()
                .filter(id -> !id.equals(characterId))
                .toList();
        return new CombatEncounter(encounter.id(), encounter.active(), encounter.roundNumber(),
                order, current, encounter.surprisedEntities(), defeated);
    }

    /**
     * Take a combatant out of the turn order (fled, dismissed). Does not end combat.
     */
    public CombatEncounter remove(CombatEncounter encounter, String characterId) {
        return without(encounter, characterId, encounter.defeated());
    }

    /**
     * Remove a defeated enemy. When no enemy or NPC is left in the turn order
     * the combat is over.
     */
    public Defeat defeat(CombatEncounter encounter, String characterId, Predicate<String> isEnemy) {
        List<String> defeated = new ArrayList<>(encounter.defeated());
        defeated.add(characterId);
        CombatEncounter next = without(encounter, characterId, defeated);
        if (next.turnOrder().stream().noneMatch(isEnemy)) {
            log.debugf("Last enemy %s defeated in encounter %s", characterId, encounter.id());
            return new Defeat(null, true);
        }
        return new Defeat(next, false);
    }

    private CombatEncounter without(CombatEncounter encounter, String characterId, List<String> defeated) {
        int removed = encounter.turnOrder().indexOf(characterId);
        if (removed < 0) {
            throw GameStateException.invalidState("Not in the turn order: " + characterId);
        }
        List<String> order = new ArrayList<>(encounter.turnOrder());
        order.remove(removed);

        int current = encounter.currentTurnIndex();
        if (order.isEmpty()) {
            current = 0;
        } else if (removed < current) {
            current--;
        } else if (current >= order.size()) {
            // the last combatant was removed on its own turn
            current = 0;
        }
        List<String> surprised = encounter.surprisedEntities().stream()
                .filter(id -> !id.equals(characterId))
                .toList();
        return new CombatEncounter(encounter.id(), encounter.active(), encounter.roundNumber(),
                order, current, surprised, defeated);
    }
}
