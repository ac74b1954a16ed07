package dev.ebullient.riddle;

import java.util.ArrayList;
import java.util.List;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.riddle.model.Character;
import dev.ebullient.riddle.model.VitalityState;

/**
 * Hit points, status conditions and death saves for one character.
 * <p>
 * Every method returns a new {@link Character}; nothing here touches the
 * roster, the encounter or storage. Damage to a character already at 0 hp is
 * never turned into a failed save here: callers record saves explicitly
 * (one failure for a hit, two for a critical).
 */
@Singleton
public class CharacterVitality {
    private static final Logger log = Logger.getLogger(CharacterVitality.class);

    static final String UNCONSCIOUS = VitalityState.UNCONSCIOUS.condition();
    static final String STABLE = VitalityState.STABLE.condition();
    static final String DEAD = VitalityState.DEAD.condition();
    static final String DEFEATED = VitalityState.DEFEATED.condition();

    /**
     * Set current hit points, clamped to [0, maxHp].
     * Dropping a PC to 0 starts a fresh death-save clock; raising a PC above 0
     * clears Unconscious/Stable and the clock.
     *
     * @throws GameStateException INVALID_STATE when healing a dead PC
     */
    public Character setHp(Character c, int requested) {
        int hp = Math.max(0, Math.min(c.maxHp(), requested));
        if (hp != requested) {
            log.warnf("Clamped hp for %s from %d to %d (max %d)", c.name(), requested, hp, c.maxHp());
        }

        if (!c.isPlayerCharacter()) {
            List<String> conditions = hp == 0
                    ? c.conditionsReplacing(List.of(), DEFEATED)
                    : c.conditionsReplacing(List.of(DEFEATED), null);
            return c.withCurrentHp(hp).withConditions(conditions);
        }

        if (c.vitality() == VitalityState.DEAD) {
            if (hp > 0) {
                throw GameStateException.invalidState(
                        c.name() + " is dead; remove the Dead condition before restoring hit points");
            }
            return c;
        }

        if (hp == 0) {
            if (c.currentHp() == 0) {
                return c;
            }
            return c.withCurrentHp(0)
                    .withConditions(c.conditionsReplacing(List.of(STABLE), UNCONSCIOUS))
                    .withDeathSaves(0, 0);
        }

        if (c.currentHp() == 0 || c.hasCondition(UNCONSCIOUS) || c.hasCondition(STABLE)
                || c.deathSaveSuccesses() > 0 || c.deathSaveFailures() > 0) {
            return c.withCurrentHp(hp)
                    .withConditions(c.conditionsReplacing(List.of(UNCONSCIOUS, STABLE), null))
                    .withDeathSaves(0, 0);
        }
        return c.withCurrentHp(hp);
    }

    public Character setTemporaryHp(Character c, int value) {
        if (value < 0) {
            throw GameStateException.validation("Temporary hp must be >= 0, got " + value);
        }
        return c.withTemporaryHp(value);
    }

    /**
     * Apply damage: temporary hp absorbs first. A PC dropped to 0 whose excess
     * damage is at least its max hp dies outright (massive damage), skipping
     * the save clock.
     */
    public Character applyDamage(Character c, int amount) {
        if (amount < 0) {
            throw GameStateException.validation("Damage must be >= 0, got " + amount);
        }
        int absorbed = Math.min(c.temporaryHp(), amount);
        int rest = amount - absorbed;
        Character afterTemp = c.withTemporaryHp(c.temporaryHp() - absorbed);
        if (rest == 0) {
            return afterTemp;
        }

        if (!c.isPlayerCharacter()) {
            return setHp(afterTemp, Math.max(0, c.currentHp() - rest));
        }
        if (c.vitality() == VitalityState.DEAD) {
            return afterTemp;
        }
        if (c.currentHp() == 0) {
            return isMassiveDamage(0, rest, c.maxHp()) ? kill(afterTemp) : afterTemp;
        }
        if (rest < c.currentHp()) {
            return afterTemp.withCurrentHp(c.currentHp() - rest);
        }
        Character down = setHp(afterTemp, 0);
        if (isMassiveDamage(c.currentHp(), rest, c.maxHp())) {
            log.infof("Massive damage: %s takes %d with %d hp left (max %d)", c.name(), rest, c.currentHp(), c.maxHp());
            return kill(down);
        }
        return down;
    }

    /** True when damage left over after reaching 0 hp is at least the character's max hp. */
    public static boolean isMassiveDamage(int hpBefore, int damage, int maxHp) {
        return damage >= hpBefore && damage - hpBefore >= maxHp;
    }

    public Character recordDeathSaveSuccess(Character c, int count) {
        requireCount(count);
        requireDying(c);
        if (c.vitality() == VitalityState.STABLE) {
            return stabilized(c);
        }
        int successes = Math.min(Character.MAX_DEATH_SAVES, c.deathSaveSuccesses() + count);
        Character updated = c.withDeathSaves(successes, c.deathSaveFailures());
        return successes >= Character.MAX_DEATH_SAVES ? stabilized(updated) : updated;
    }

    /**
     * Record failed death saves. A stable character that fails starts dying
     * again: Stable is replaced by Unconscious and the success count resets.
     */
    public Character recordDeathSaveFailure(Character c, int count) {
        requireCount(count);
        requireDying(c);
        Character base = c;
        if (c.vitality() == VitalityState.STABLE && count > 0) {
            base = c.withDeathSaves(0, c.deathSaveFailures())
                    .withConditions(c.conditionsReplacing(List.of(STABLE), UNCONSCIOUS));
        }
        int failures = Math.min(Character.MAX_DEATH_SAVES, base.deathSaveFailures() + count);
        Character updated = base.withDeathSaves(base.deathSaveSuccesses(), failures);
        if (failures >= Character.MAX_DEATH_SAVES) {
            return updated.withConditions(updated.conditionsReplacing(List.of(UNCONSCIOUS, STABLE), DEAD));
        }
        return updated;
    }

    /** Another character's action stabilizes this one: successes jump straight to 3. */
    public Character stabilize(Character c) {
        requireDying(c);
        return stabilized(c);
    }

    /**
     * Add a condition. Status conditions drive the state machine: Dead kills
     * outright, Unconscious drops to 0, Stable stabilizes, Defeated (enemies
     * only) drops to 0.
     */
    public Character addCondition(Character c, String name) {
        String condition = requireConditionName(name);
        VitalityState status = VitalityState.forCondition(condition);
        if (status == null) {
            return c.withConditions(c.conditionsReplacing(List.of(), condition));
        }
        if (!c.isPlayerCharacter()) {
            Character down = setHp(c, 0);
            return down.withConditions(down.conditionsReplacing(List.of(), status.condition()));
        }
        return switch (status) {
            case DEAD -> kill(c);
            case UNCONSCIOUS -> c.currentHp() > 0
                    ? setHp(c, 0)
                    : c.withConditions(c.conditionsReplacing(List.of(), UNCONSCIOUS));
            case STABLE -> stabilize(c);
            case DEFEATED -> throw GameStateException.validation(
                    "Defeated applies only to enemies and NPCs, not " + c.name());
            default -> c;
        };
    }

    /**
     * Remove a condition. Removing Dead from a PC also clears a full failure
     * clock; removing Stable at 0 hp puts the character back on the clock.
     */
    public Character removeCondition(Character c, String name) {
        String condition = requireConditionName(name);
        if (!c.hasCondition(condition)) {
            return c;
        }
        Character updated = c.withConditions(c.conditionsReplacing(List.of(condition), null));
        if (!c.isPlayerCharacter()) {
            return updated;
        }
        VitalityState status = VitalityState.forCondition(condition);
        if (status == VitalityState.DEAD || status == VitalityState.STABLE) {
            updated = updated.withDeathSaves(0, 0);
            if (updated.currentHp() == 0) {
                updated = updated.withConditions(updated.conditionsReplacing(List.of(), UNCONSCIOUS));
            }
        }
        return updated;
    }

    /** Replace the whole condition list (a DM override). */
    public Character setConditions(Character c, List<String> values) {
        List<String> conditions = new ArrayList<>();
        for (String value : values == null ? List.<String> of() : values) {
            String condition = requireConditionName(value);
            VitalityState status = VitalityState.forCondition(condition);
            if (status == VitalityState.DEFEATED && c.isPlayerCharacter()) {
                throw GameStateException.validation(
                        "Defeated applies only to enemies and NPCs, not " + c.name());
            }
            String canonical = status == null ? condition : status.condition();
            if (conditions.stream().noneMatch(x -> x.equalsIgnoreCase(canonical))) {
                conditions.add(canonical);
            }
        }
        Character updated = c.withConditions(conditions);
        if (c.isPlayerCharacter()) {
            int successes = c.deathSaveSuccesses();
            int failures = c.deathSaveFailures();
            if (failures >= Character.MAX_DEATH_SAVES && !updated.hasCondition(DEAD)) {
                failures = 0;
                successes = 0;
            }
            if (successes >= Character.MAX_DEATH_SAVES && !updated.hasCondition(STABLE)) {
                successes = 0;
            }
            updated = updated.withDeathSaves(successes, failures);
        }
        return updated;
    }

    private Character stabilized(Character c) {
        return c.withDeathSaves(Character.MAX_DEATH_SAVES, c.deathSaveFailures())
                .withConditions(c.conditionsReplacing(List.of(UNCONSCIOUS), STABLE));
    }

    private Character kill(Character c) {
        return c.withCurrentHp(0)
                .withConditions(c.conditionsReplacing(List.of(UNCONSCIOUS, STABLE), DEAD));
    }

    private void requireDying(Character c) {
        if (!c.isPlayerCharacter()) {
            throw GameStateException.invalidState(c.name() + " is not a player character and makes no death saves");
        }
        VitalityState state = c.vitality();
        if (state == VitalityState.ALIVE) {
            throw GameStateException.invalidState(c.name() + " is not at 0 hp");
        }
        if (state == VitalityState.DEAD) {
            throw GameStateException.invalidState(c.name() + " is dead");
        }
    }

    private static void requireCount(int count) {
        if (count < 0) {
            throw GameStateException.validation("Death save count must be >= 0, got " + count);
        }
    }

    private static String requireConditionName(String name) {
        if (name == null || name.isBlank()) {
            throw GameStateException.validation("Condition name is required");
        }
        return name.trim();
    }
}
