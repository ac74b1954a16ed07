package dev.ebullient.riddle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.ebullient.riddle.model.Character;
import dev.ebullient.riddle.model.CharacterType;
import dev.ebullient.riddle.model.VitalityState;

class CharacterVitalityTest {

    final CharacterVitality vitality = new CharacterVitality();

    static Character elara(int hp) {
        return Character.create("elara", "Elara", CharacterType.PC, hp, 20);
    }

    static Character goblin(int hp) {
        return Character.create("goblin", "Goblin", CharacterType.ENEMY, hp, 7);
    }

    Character unconscious() {
        return vitality.setHp(elara(3), 0);
    }

    @Test
    void setHp_zeroStartsDeathSaves() {
        Character down = vitality.setHp(elara(3), 0);

        assertEquals(0, down.currentHp());
        assertEquals(List.of("Unconscious"), down.conditions());
        assertEquals(0, down.deathSaveSuccesses());
        assertEquals(0, down.deathSaveFailures());
        assertEquals(VitalityState.UNCONSCIOUS, down.vitality());
    }

    @Test
    void setHp_zeroResetsLeftoverCounters() {
        Character c = elara(3).withDeathSaves(2, 1);
        Character down = vitality.setHp(c, 0);

        assertEquals(0, down.deathSaveSuccesses());
        assertEquals(0, down.deathSaveFailures());
    }

    @Test
    void setHp_clampsToRange() {
        assertEquals(20, vitality.setHp(elara(3), 45).currentHp());
        assertEquals(0, vitality.setHp(elara(3), -4).currentHp());
    }

    @Test
    void threeFailures_dead() {
        Character c = unconscious();
        c = vitality.recordDeathSaveFailure(c, 1);
        c = vitality.recordDeathSaveFailure(c, 1);
        assertEquals(VitalityState.UNCONSCIOUS, c.vitality());
        c = vitality.recordDeathSaveFailure(c, 1);

        assertEquals(3, c.deathSaveFailures());
        assertEquals(List.of("Dead"), c.conditions());
        assertEquals(VitalityState.DEAD, c.vitality());
        assertFalse(c.hasCondition("Stable"));
    }

    @Test
    void failures_capAtThree() {
        Character c = vitality.recordDeathSaveFailure(unconscious(), 2);
        c = vitality.recordDeathSaveFailure(c, 2);

        assertEquals(3, c.deathSaveFailures());
        assertEquals(VitalityState.DEAD, c.vitality());
    }

    @Test
    void threeSuccesses_stable() {
        Character c = unconscious();
        c = vitality.recordDeathSaveSuccess(c, 1);
        c = vitality.recordDeathSaveSuccess(c, 2);

        assertEquals(3, c.deathSaveSuccesses());
        assertEquals(List.of("Stable"), c.conditions());
        assertEquals(VitalityState.STABLE, c.vitality());
    }

    @Test
    void stabilize_jumpsToThreeSuccesses() {
        Character c = unconscious().withDeathSaves(1, 2);
        Character stable = vitality.stabilize(c);

        assertEquals(3, stable.deathSaveSuccesses());
        assertEquals(2, stable.deathSaveFailures());
        assertEquals(List.of("Stable"), stable.conditions());
    }

    @Test
    void stableCharacterFailing_backOnTheClock() {
        Character stable = vitality.stabilize(unconscious());
        Character c = vitality.recordDeathSaveFailure(stable, 1);

        assertEquals(0, c.deathSaveSuccesses());
        assertEquals(1, c.deathSaveFailures());
        assertEquals(List.of("Unconscious"), c.conditions());
    }

    @Test
    void healingAfterZero_resetsCounters() {
        for (Character before : List.of(
                vitality.recordDeathSaveFailure(vitality.recordDeathSaveSuccess(unconscious(), 1), 2),
                vitality.stabilize(unconscious()))) {
            Character healed = vitality.setHp(before, 5);

            assertEquals(5, healed.currentHp());
            assertEquals(0, healed.deathSaveSuccesses());
            assertEquals(0, healed.deathSaveFailures());
            assertTrue(healed.conditions().isEmpty());
            assertEquals(VitalityState.ALIVE, healed.vitality());
        }
    }

    @Test
    void healingDead_rejected() {
        Character dead = vitality.addCondition(unconscious(), "Dead");

        GameStateException e = assertThrows(GameStateException.class, () -> vitality.setHp(dead, 10));
        assertEquals(GameStateException.ErrorKind.INVALID_STATE, e.kind());
    }

    @Test
    void removingDead_allowsRevival() {
        Character dead = unconscious();
        for (int i = 0; i < 3; i++) {
            dead = vitality.recordDeathSaveFailure(dead, 1);
        }
        Character revived = vitality.removeCondition(dead, "dead");

        assertEquals(0, revived.deathSaveFailures());
        assertEquals(List.of("Unconscious"), revived.conditions());
        assertEquals(VitalityState.UNCONSCIOUS, revived.vitality());
        assertEquals(8, vitality.setHp(revived, 8).currentHp());
    }

    @Test
    void deathSaves_rejectedUnlessDying() {
        assertEquals(GameStateException.ErrorKind.INVALID_STATE,
                assertThrows(GameStateException.class, () -> vitality.recordDeathSaveSuccess(elara(3), 1)).kind());
        assertEquals(GameStateException.ErrorKind.INVALID_STATE,
                assertThrows(GameStateException.class, () -> vitality.stabilize(goblin(0))).kind());
        assertEquals(GameStateException.ErrorKind.VALIDATION,
                assertThrows(GameStateException.class, () -> vitality.recordDeathSaveFailure(unconscious(), -1)).kind());
    }

    @Test
    void enemyAtZero_defeated() {
        Character down = vitality.setHp(goblin(2), 0);

        assertEquals(List.of("Defeated"), down.conditions());
        assertEquals(VitalityState.DEFEATED, down.vitality());
        assertEquals(0, down.deathSaveFailures());
    }

    @Test
    void defeatedCondition_rejectedOnPlayerCharacter() {
        assertThrows(GameStateException.class, () -> vitality.addCondition(elara(3), "Defeated"));
        assertThrows(GameStateException.class, () -> vitality.setConditions(elara(3), List.of("Poisoned", "Defeated")));
    }

    @Test
    void damage_temporaryHpAbsorbsFirst() {
        Character c = vitality.setTemporaryHp(elara(10), 4);
        Character hit = vitality.applyDamage(c, 6);

        assertEquals(0, hit.temporaryHp());
        assertEquals(8, hit.currentHp());
    }

    @Test
    void damage_toZeroStartsDeathSaves() {
        Character hit = vitality.applyDamage(elara(5), 9);

        assertEquals(0, hit.currentHp());
        assertEquals(VitalityState.UNCONSCIOUS, hit.vitality());
    }

    @Test
    void massiveDamage_killsOutright() {
        Character hit = vitality.applyDamage(elara(5), 25);

        assertEquals(VitalityState.DEAD, hit.vitality());
        assertEquals(List.of("Dead"), hit.conditions());
        assertEquals(0, hit.deathSaveFailures());
        assertTrue(CharacterVitality.isMassiveDamage(5, 25, 20));
        assertFalse(CharacterVitality.isMassiveDamage(5, 24, 20));
    }

    @Test
    void damageAtZero_recordsNoSave() {
        Character down = unconscious();
        Character hit = vitality.applyDamage(down, 3);

        assertEquals(0, hit.deathSaveFailures());
        assertEquals(VitalityState.UNCONSCIOUS, hit.vitality());
    }

    @Test
    void addUnconscious_dropsToZero() {
        Character c = vitality.addCondition(elara(12), "unconscious");

        assertEquals(0, c.currentHp());
        assertEquals(List.of("Unconscious"), c.conditions());
    }

    @Test
    void ordinaryConditions_keptAcrossStateChanges() {
        Character c = vitality.addCondition(elara(3), "Poisoned");
        c = vitality.setHp(c, 0);
        c = vitality.stabilize(c);
        c = vitality.setHp(c, 4);

        assertEquals(List.of("Poisoned"), c.conditions());
    }

    @Test
    void setConditions_clearsCountersOfRemovedStatus() {
        Character stable = vitality.stabilize(unconscious());
        Character c = vitality.setConditions(stable, List.of("Unconscious", "Prone", "prone"));

        assertEquals(List.of("Unconscious", "Prone"), c.conditions());
        assertEquals(0, c.deathSaveSuccesses());
    }
}
