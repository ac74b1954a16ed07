package dev.ebullient.riddle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import dev.ebullient.riddle.model.Character;
import dev.ebullient.riddle.model.CharacterType;
import dev.ebullient.riddle.model.CombatEncounter;

class TurnOrderManagerTest {

    final TurnOrderManager turns = new TurnOrderManager();

    static Character pc(String name, int initiative) {
        return Character.create(name.toLowerCase(), name, CharacterType.PC, 10, 10).withInitiative(initiative);
    }

    static Character enemy(String name, int initiative) {
        return Character.create(name.toLowerCase(), name, CharacterType.ENEMY, 5, 5).withInitiative(initiative);
    }

    static Map<String, Integer> initiatives(Character... characters) {
        Map<String, Integer> map = new HashMap<>();
        for (Character c : characters) {
            map.put(c.id(), c.initiative());
        }
        return map;
    }

    @Test
    void start_sortsByInitiative() {
        CombatEncounter enc = turns.start(List.of(pc("Thorin", 15), pc("Elara", 18)), Set.of());

        assertEquals(List.of("elara", "thorin"), enc.turnOrder());
        assertEquals(0, enc.currentTurnIndex());
        assertEquals(1, enc.roundNumber());
        assertTrue(enc.active());
        assertEquals("elara", enc.currentCombatantId());
    }

    @Test
    void start_tiesKeepGivenOrder() {
        CombatEncounter enc = turns.start(List.of(pc("A", 10), pc("B", 12), pc("C", 10)), Set.of());

        assertEquals(List.of("b", "a", "c"), enc.turnOrder());
    }

    @Test
    void start_rejectsEmptyAndDuplicates() {
        assertThrows(GameStateException.class, () -> turns.start(List.of(), Set.of()));
        assertThrows(GameStateException.class, () -> turns.start(List.of(pc("A", 1), pc("A", 2)), Set.of()));
    }

    @Test
    void advance_twiceWrapsToNextRound() {
        CombatEncounter enc = turns.start(List.of(pc("Elara", 18), pc("Thorin", 15)), Set.of());
        enc = turns.advance(enc);
        assertEquals(1, enc.currentTurnIndex());
        assertEquals(1, enc.roundNumber());

        enc = turns.advance(enc);
        assertEquals(0, enc.currentTurnIndex());
        assertEquals(2, enc.roundNumber());
        assertEquals("elara", enc.currentCombatantId());
    }

    @Test
    void advance_fullPassIsOneRound() {
        for (int size = 1; size <= 6; size++) {
            Character[] cs = new Character[size];
            for (int i = 0; i < size; i++) {
                cs[i] = pc("C" + i, 20 - i);
            }
            CombatEncounter enc = turns.start(List.of(cs), Set.of());
            int initialRound = enc.roundNumber();
            for (int i = 0; i < size; i++) {
                enc = turns.advance(enc);
            }
            assertEquals(0, enc.currentTurnIndex(), "size " + size);
            assertEquals(initialRound + 1, enc.roundNumber(), "size " + size);
        }
    }

    @Test
    void surprise_clearedWhenRoundOneEnds() {
        CombatEncounter enc = turns.start(List.of(pc("Elara", 18), enemy("Goblin", 12)), Set.of("goblin", "nobody"));
        assertEquals(List.of("goblin"), enc.surprisedEntities());

        enc = turns.advance(enc);
        assertTrue(enc.isSurprised("goblin"));
        enc = turns.advance(enc);
        assertFalse(enc.isSurprised("goblin"));
    }

    @Test
    void reorder_keepsTurnWithSameCombatant() {
        Character elara = pc("Elara", 18);
        Character thorin = pc("Thorin", 15);
        Character goblin = enemy("Goblin", 10);
        CombatEncounter enc = turns.advance(turns.start(List.of(elara, thorin, goblin), Set.of()));
        assertEquals("thorin", enc.currentCombatantId());

        Map<String, Integer> init = initiatives(elara, thorin, goblin);
        init.put("goblin", 25);
        CombatEncounter reordered = turns.reorder(enc, init::get);

        assertEquals(List.of("goblin", "elara", "thorin"), reordered.turnOrder());
        assertEquals("thorin", reordered.currentCombatantId());
        assertEquals(2, reordered.currentTurnIndex());
    }

    @Test
    void remove_beforeCurrentShiftsIndex() {
        CombatEncounter enc = turns.start(List.of(pc("A", 20), pc("B", 15), pc("C", 10)), Set.of());
        enc = turns.advance(turns.advance(enc));
        assertEquals("c", enc.currentCombatantId());

        CombatEncounter after = turns.remove(enc, "a");
        assertEquals(1, after.currentTurnIndex());
        assertEquals("c", after.currentCombatantId());
    }

    @Test
    void remove_currentPassesTurnOn() {
        CombatEncounter enc = turns.advance(turns.start(List.of(pc("A", 20), pc("B", 15), pc("C", 10)), Set.of()));
        CombatEncounter after = turns.remove(enc, "b");

        assertEquals("c", after.currentCombatantId());
    }

    @Test
    void remove_lastOnItsTurnWrapsToStart() {
        CombatEncounter enc = turns.start(List.of(pc("A", 20), pc("B", 15)), Set.of());
        enc = turns.advance(enc);
        CombatEncounter after = turns.remove(enc, "b");

        assertEquals(0, after.currentTurnIndex());
        assertEquals("a", after.currentCombatantId());
    }

    @Test
    void remove_everyoneLeavesEmptyOrder() {
        CombatEncounter enc = turns.remove(turns.start(List.of(pc("A", 20)), Set.of()), "a");

        assertTrue(enc.turnOrder().isEmpty());
        assertEquals(0, enc.currentTurnIndex());
        assertNull(enc.currentCombatantId());
        assertThrows(GameStateException.class, () -> turns.advance(enc));
    }

    @Test
    void remove_unknownRejected() {
        CombatEncounter enc = turns.start(List.of(pc("A", 20)), Set.of());
        GameStateException e = assertThrows(GameStateException.class, () -> turns.remove(enc, "zed"));
        assertEquals(GameStateException.ErrorKind.INVALID_STATE, e.kind());
    }

    @Test
    void defeat_lastEnemyEndsCombat() {
        Character elara = pc("Elara", 18);
        Character goblin = enemy("Goblin", 12);
        Map<String, Character> byId = Map.of("elara", elara, "goblin", goblin);
        CombatEncounter enc = turns.start(List.of(elara, goblin), Set.of());

        TurnOrderManager.Defeat defeat = turns.defeat(enc, "goblin", id -> !byId.get(id).isPlayerCharacter());

        assertTrue(defeat.combatEnded());
        assertNull(defeat.encounter());
    }

    @Test
    void defeat_otherEnemiesKeepFighting() {
        Character elara = pc("Elara", 18);
        Character goblin = enemy("Goblin", 12);
        Character wolf = enemy("Wolf", 8);
        Map<String, Character> byId = Map.of("elara", elara, "goblin", goblin, "wolf", wolf);
        CombatEncounter enc = turns.start(List.of(elara, goblin, wolf), Set.of());

        TurnOrderManager.Defeat defeat = turns.defeat(enc, "goblin", id -> !byId.get(id).isPlayerCharacter());

        assertFalse(defeat.combatEnded());
        assertEquals(List.of("elara", "wolf"), defeat.encounter().turnOrder());
        assertEquals(List.of("goblin"), defeat.encounter().defeated());
    }

    @Test
    void add_insertsAfterEqualInitiativeAndKeepsTurn() {
        Character a = pc("A", 20);
        Character b = pc("B", 15);
        Character c = pc("C", 10);
        CombatEncounter enc = turns.advance(turns.advance(turns.start(List.of(a, b, c), Set.of())));
        assertEquals("c", enc.currentCombatantId());

        Map<String, Integer> init = initiatives(a, b, c);
        init.put("d", 15);
        CombatEncounter added = turns.add(enc, "d", init::get);

        assertEquals(List.of("a", "b", "d", "c"), added.turnOrder());
        assertEquals("c", added.currentCombatantId());
        assertThrows(GameStateException.class, () -> turns.add(added, "d", init::get));
    }
}
