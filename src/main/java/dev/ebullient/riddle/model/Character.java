package dev.ebullient.riddle.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A roster character (PC or enemy/NPC). This is the only place hit points,
 * conditions and death saves live; combat views are built from it.
 */
public record Character(
        String id,
        String name,
        CharacterType type,
        int maxHp,
        int currentHp,
        int temporaryHp,
        int armorClass,
        int initiative,
        List<String> conditions,
        String statusNotes,
        int deathSaveSuccesses,
        int deathSaveFailures,
        String playerId,
        String playerName) {

    public static final int MAX_DEATH_SAVES = 3;

    public Character {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Character id is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Character name is required");
        }
        if (type == null) {
            type = CharacterType.PC;
        }
        if (maxHp < 0) {
            throw new IllegalArgumentException("Max hp must be >= 0, got " + maxHp);
        }
        if (currentHp < 0 || currentHp > maxHp) {
            throw new IllegalArgumentException("Current hp must be 0-" + maxHp + ", got " + currentHp);
        }
        if (temporaryHp < 0) {
            throw new IllegalArgumentException("Temporary hp must be >= 0, got " + temporaryHp);
        }
        if (deathSaveSuccesses < 0 || deathSaveSuccesses > MAX_DEATH_SAVES) {
            throw new IllegalArgumentException("Death save successes must be 0-3, got " + deathSaveSuccesses);
        }
        if (deathSaveFailures < 0 || deathSaveFailures > MAX_DEATH_SAVES) {
            throw new IllegalArgumentException("Death save failures must be 0-3, got " + deathSaveFailures);
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Character create(String id, String name, CharacterType type, int currentHp, int maxHp) {
        return new Character(id, name, type, maxHp, currentHp, 0, 10, 0,
                List.of(), null, 0, 0, null, null);
    }

    @JsonIgnore
    public boolean isPlayerCharacter() {
        return type.isPlayer();
    }

    /** Status derived from hp, status conditions and the death-save clock. */
    public VitalityState vitality() {
        if (!isPlayerCharacter()) {
            return currentHp == 0 || hasCondition(VitalityState.DEFEATED.condition())
                    ? VitalityState.DEFEATED
                    : VitalityState.ALIVE;
        }
        if (hasCondition(VitalityState.DEAD.condition()) || deathSaveFailures >= MAX_DEATH_SAVES) {
            return VitalityState.DEAD;
        }
        if (currentHp > 0) {
            return VitalityState.ALIVE;
        }
        if (hasCondition(VitalityState.STABLE.condition()) || deathSaveSuccesses >= MAX_DEATH_SAVES) {
            return VitalityState.STABLE;
        }
        return VitalityState.UNCONSCIOUS;
    }

    public boolean hasCondition(String condition) {
        return conditions.stream().anyMatch(c -> c.equalsIgnoreCase(condition));
    }

    public Character withCurrentHp(int hp) {
        return new Character(id, name, type, maxHp, hp, temporaryHp, armorClass, initiative,
                conditions, statusNotes, deathSaveSuccesses, deathSaveFailures, playerId, playerName);
    }

    public Character withTemporaryHp(int tempHp) {
        return new Character(id, name, type, maxHp, currentHp, tempHp, armorClass, initiative,
                conditions, statusNotes, deathSaveSuccesses, deathSaveFailures, playerId, playerName);
    }

    public Character withInitiative(int value) {
        return new Character(id, name, type, maxHp, currentHp, temporaryHp, armorClass, value,
                conditions, statusNotes, deathSaveSuccesses, deathSaveFailures, playerId, playerName);
    }

    public Character withConditions(List<String> values) {
        return new Character(id, name, type, maxHp, currentHp, temporaryHp, armorClass, initiative,
                values, statusNotes, deathSaveSuccesses, deathSaveFailures, playerId, playerName);
    }

    public Character withStatusNotes(String notes) {
        return new Character(id, name, type, maxHp, currentHp, temporaryHp, armorClass, initiative,
                conditions, notes, deathSaveSuccesses, deathSaveFailures, playerId, playerName);
    }

    public Character withDeathSaves(int successes, int failures) {
        return new Character(id, name, type, maxHp, currentHp, temporaryHp, armorClass, initiative,
                conditions, statusNotes, successes, failures, playerId, playerName);
    }

    /** Claimed by a player, or released when both are null. */
    public Character withPlayer(String id, String name) {
        return new Character(this.id, this.name, type, maxHp, currentHp, temporaryHp, armorClass, initiative,
                conditions, statusNotes, deathSaveSuccesses, deathSaveFailures, id, name);
    }

    /** Conditions with {@code remove} dropped (case-insensitive) and {@code add} appended if missing. */
    public List<String> conditionsReplacing(List<String> remove, String add) {
        List<String> result = new ArrayList<>();
        for (String c : conditions) {
            if (remove.stream().noneMatch(r -> r.equalsIgnoreCase(c))) {
                result.add(c);
            }
        }
        if (add != null && result.stream().noneMatch(c -> c.equalsIgnoreCase(add))) {
            result.add(add);
        }
        return result;
    }
}
