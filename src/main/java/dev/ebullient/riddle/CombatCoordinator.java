package dev.ebullient.riddle;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.riddle.model.CampaignState;
import dev.ebullient.riddle.model.Character;
import dev.ebullient.riddle.model.CharacterStatePayload;
import dev.ebullient.riddle.model.CharacterType;
import dev.ebullient.riddle.model.CombatEncounter;
import dev.ebullient.riddle.model.CombatEndedPayload;
import dev.ebullient.riddle.model.CombatStatePayload;
import dev.ebullient.riddle.model.CombatantSpec;
import dev.ebullient.riddle.model.VitalityState;
import dev.ebullient.riddle.notify.Audience;
import dev.ebullient.riddle.notify.EventType;
import dev.ebullient.riddle.notify.GameEvent;
import dev.ebullient.riddle.notify.NotificationRouter;

/**
 * Turns one mutation request into one committed campaign state and one event.
 * <p>
 * Each call runs under the campaign's lock: load, apply, bump the version,
 * save, then publish. Everything before the save works on immutable values,
 * so any failure (including a failed save) leaves the stored state as it was
 * and publishes nothing. Events are published while the lock is still held,
 * which keeps the per-campaign event stream in version order.
 */
@Singleton
public class CombatCoordinator {
    private static final Logger log = Logger.getLogger(CombatCoordinator.class);

    /**
     * The outcome of applying a mutation to a loaded state, before it is
     * committed. A change without an event type is saved and not published.
     */
    public record Change(
            CampaignState state,
            EventType type,
            Function<CampaignState, Object> payload) {
    }

    @Inject
    CampaignStore store;

    @Inject
    CharacterVitality vitality;

    @Inject
    TurnOrderManager turns;

    @Inject
    NotificationRouter router;

    public MutationResult mutate(String campaignId, String operation, Function<CampaignState, Change> apply) {
        synchronized (CampaignLocks.lockFor(campaignId)) {
            CampaignState current = store.load(campaignId);
            Change change;
            try {
                change = apply.apply(current);
            } catch (IllegalArgumentException e) {
                throw GameStateException.validation(e.getMessage());
            }
            CampaignState next = change.state().nextVersion();
            store.save(next);
            if (change.type() == null) {
                log.infof("Campaign %s v%d: %s", campaignId, next.version(), operation);
                return new MutationResult(next, null, Set.of());
            }

            GameEvent event = new GameEvent(campaignId, change.type(), change.payload().apply(next));
            log.infof("Campaign %s v%d: %s -> %s", campaignId, next.version(), operation, event.eventName());
            Set<Audience> audiences = router.publish(event);
            return new MutationResult(next, event, audiences);
        }
    }

    public CampaignState getGameState(String campaignId) {
        synchronized (CampaignLocks.lockFor(campaignId)) {
            return store.load(campaignId);
        }
    }

    /** The combat view, or null when no combat is active. */
    public CombatStatePayload getCombatState(String campaignId) {
        return getGameState(campaignId).combatView();
    }

    public MutationResult startCombat(String campaignId, List<CombatantSpec> combatants) {
        return mutate(campaignId, "start_combat", state -> {
            if (state.hasActiveCombat()) {
                throw GameStateException.invalidState("Combat is already active in " + campaignId);
            }
            if (combatants == null || combatants.isEmpty()) {
                throw GameStateException.validation("Combat needs at least one combatant");
            }
            CampaignState next = state;
            List<Character> inCombat = new ArrayList<>();
            Set<String> surprised = new LinkedHashSet<>();
            for (CombatantSpec spec : combatants) {
                Character c = requireLive(combatantFor(next, spec));
                next = next.withCharacter(c);
                inCombat.add(c);
                if (spec.surprised()) {
                    surprised.add(c.id());
                }
            }
            CombatEncounter encounter = turns.start(inCombat, surprised);
            return new Change(next.withCombat(encounter), EventType.COMBAT_STARTED, CampaignState::combatView);
        });
    }

    /** Change a combatant's initiative and re-sort; the turn stays with the same combatant. */
    public MutationResult setInitiative(String campaignId, String characterIdOrName, int value) {
        return mutate(campaignId, "set_initiative " + characterIdOrName, state -> {
            Character c = state.resolveCharacter(characterIdOrName);
            CombatEncounter combat = requireInTurnOrder(state, c);
            CampaignState next = state.withCharacter(c.withInitiative(value));
            CombatEncounter reordered = turns.reorder(combat, initiativeOf(next));
            return new Change(next.withCombat(reordered), EventType.INITIATIVE_SET, CampaignState::combatView);
        });
    }

    public MutationResult advanceTurn(String campaignId) {
        return mutate(campaignId, "advance_turn", state -> {
            CombatEncounter combat = requireCombat(state);
            return new Change(state.withCombat(turns.advance(combat)), EventType.TURN_ADVANCED,
                    CampaignState::combatView);
        });
    }

    /**
     * Apply one keyed change to a character. An enemy or NPC in the turn order
     * that ends up defeated is taken out of it, which ends the combat when no
     * enemy is left; the single event still describes the character.
     */
    public MutationResult updateCharacterState(String campaignId, String characterIdOrName, String key, JsonNode value) {
        return mutate(campaignId, key + " " + characterIdOrName, state -> {
            Character c = state.resolveCharacter(characterIdOrName);
            Character updated = applyKey(c, key, value);
            CampaignState next = settleTurnOrder(state.withCharacter(updated), c, updated);
            String id = c.id();
            return new Change(next, EventType.CHARACTER_STATE_UPDATED, s -> characterPayload(s, id));
        });
    }

    /** Defeat an enemy or NPC: hp to 0, out of the turn order, and combat ends with the last one. */
    public MutationResult markDefeated(String campaignId, String characterIdOrName) {
        return mutate(campaignId, "mark_defeated " + characterIdOrName, state -> {
            Character c = state.resolveCharacter(characterIdOrName);
            if (c.isPlayerCharacter()) {
                throw GameStateException.invalidState(c.name() + " is a player character and cannot be defeated");
            }
            CombatEncounter combat = requireInTurnOrder(state, c);
            CampaignState next = state.withCharacter(vitality.setHp(c, 0));
            TurnOrderManager.Defeat defeat = turns.defeat(combat, c.id(), isEnemy(next));
            if (defeat.combatEnded()) {
                return new Change(next.withCombat(null), EventType.COMBAT_ENDED,
                        s -> new CombatEndedPayload(s.version(), combat.id(), CombatEndedPayload.ALL_ENEMIES_DEFEATED));
            }
            String id = c.id();
            return new Change(next.withCombat(defeat.encounter()), EventType.COMBATANT_DEFEATED,
                    s -> characterPayload(s, id));
        });
    }

    public MutationResult endCombat(String campaignId) {
        return mutate(campaignId, "end_combat", state -> {
            CombatEncounter combat = requireCombat(state);
            return new Change(state.withCombat(null), EventType.COMBAT_ENDED,
                    s -> new CombatEndedPayload(s.version(), combat.id(), CombatEndedPayload.ENDED_BY_DM));
        });
    }

    /** Join an active combat; new characters are added to the roster. */
    public MutationResult addCombatant(String campaignId, CombatantSpec spec) {
        return mutate(campaignId, "add_combatant", state -> {
            CombatEncounter combat = requireCombat(state);
            if (spec == null) {
                throw GameStateException.validation("Combatant is required");
            }
            Character c = requireLive(combatantFor(state, spec));
            CampaignState next = state.withCharacter(c);
            CombatEncounter added = turns.add(combat, c.id(), initiativeOf(next));
            if (spec.surprised() && added.roundNumber() == 1 && !added.isSurprised(c.id())) {
                List<String> surprised = new ArrayList<>(added.surprisedEntities());
                surprised.add(c.id());
                added = new CombatEncounter(added.id(), added.active(), added.roundNumber(), added.turnOrder(),
                        added.currentTurnIndex(), surprised, added.defeated());
            }
            return new Change(next.withCombat(added), EventType.COMBATANT_ADDED, CampaignState::combatView);
        });
    }

    /** Take a combatant out of the fight without defeating it. Never ends combat. */
    public MutationResult removeCombatant(String campaignId, String characterIdOrName) {
        return mutate(campaignId, "remove_combatant " + characterIdOrName, state -> {
            Character c = state.resolveCharacter(characterIdOrName);
            CombatEncounter combat = requireInTurnOrder(state, c);
            return new Change(state.withCombat(turns.remove(combat, c.id())), EventType.COMBATANT_REMOVED,
                    CampaignState::combatView);
        });
    }

    /**
     * Add or replace a roster character. A replacement that leaves an enemy
     * in the turn order defeated is handled like a hit point update.
     */
    public MutationResult upsertCharacter(String campaignId, Character character) {
        if (character == null) {
            throw GameStateException.validation("Character is required");
        }
        return mutate(campaignId, "upsert " + character.id(), state -> {
            Character previous = state.findById(character.id());
            Character normalized = vitality.setConditions(character, character.conditions());
            CampaignState next = settleTurnOrder(state.withCharacter(normalized), previous, normalized);
            String id = normalized.id();
            return new Change(next, EventType.CHARACTER_STATE_UPDATED, s -> characterPayload(s, id));
        });
    }

    Character applyKey(Character c, String key, JsonNode value) {
        if (key == null || key.isBlank()) {
            throw GameStateException.validation("Update key is required");
        }
        return switch (key) {
            case "current_hp" -> vitality.setHp(c, intValue(key, value));
            case "temporary_hp" -> vitality.setTemporaryHp(c, intValue(key, value));
            case "damage" -> vitality.applyDamage(c, intValue(key, value));
            case "conditions" -> vitality.setConditions(c, stringList(value));
            case "add_condition" -> vitality.addCondition(c, textValue(key, value));
            case "remove_condition" -> vitality.removeCondition(c, textValue(key, value));
            case "status_notes" -> c.withStatusNotes(value == null || value.isNull() ? null : value.asText());
            case "initiative" -> c.withInitiative(intValue(key, value));
            case "death_save_success" -> vitality.recordDeathSaveSuccess(c, countValue(key, value));
            case "death_save_failure" -> vitality.recordDeathSaveFailure(c, countValue(key, value));
            case "stabilize" -> vitality.stabilize(c);
            default -> throw GameStateException.validation("Unknown character state key: " + key);
        };
    }

    /**
     * Keep the turn order consistent with a changed character: a defeated enemy
     * or NPC leaves it (ending combat with the last one), a new initiative re-sorts it.
     */
    private CampaignState settleTurnOrder(CampaignState next, Character before, Character updated) {
        if (!next.hasActiveCombat() || !next.combat().inTurnOrder(updated.id())) {
            return next;
        }
        CombatEncounter combat = next.combat();
        if (!updated.isPlayerCharacter() && updated.vitality() == VitalityState.DEFEATED) {
            TurnOrderManager.Defeat defeat = turns.defeat(combat, updated.id(), isEnemy(next));
            if (defeat.combatEnded()) {
                log.debugf("%s was the last enemy; combat %s is over", updated.name(), combat.id());
            }
            return next.withCombat(defeat.encounter());
        }
        if (before != null && before.initiative() != updated.initiative()) {
            return next.withCombat(turns.reorder(combat, initiativeOf(next)));
        }
        return next;
    }

    private static Character requireLive(Character c) {
        if (!c.isPlayerCharacter() && c.vitality() == VitalityState.DEFEATED) {
            throw GameStateException.invalidState(c.name() + " is defeated; restore hit points before it joins combat");
        }
        return c;
    }

    private Character combatantFor(CampaignState state, CombatantSpec spec) {
        Character existing = existingCharacter(state, spec);
        if (existing != null) {
            Character joining = existing.withInitiative(spec.initiative());
            if (spec.currentHp() != null && !existing.isPlayerCharacter()) {
                joining = vitality.setHp(joining, spec.currentHp());
            }
            return joining;
        }
        if (spec.name() == null || spec.name().isBlank()) {
            throw GameStateException.validation("Combatant name is required");
        }
        if (spec.maxHp() == null) {
            throw GameStateException.validation("Max hp is required for new combatant " + spec.name());
        }
        int maxHp = spec.maxHp();
        int hp = spec.currentHp() == null ? maxHp : Math.max(0, Math.min(maxHp, spec.currentHp()));
        String id = spec.id() == null || spec.id().isBlank() ? UUID.randomUUID().toString() : spec.id();
        CharacterType type = spec.type() == null ? CharacterType.ENEMY : spec.type();
        log.debugf("Adding %s %s (%s) to the roster", type.display(), spec.name(), id);
        return Character.create(id, spec.name(), type, hp, maxHp).withInitiative(spec.initiative());
    }

    private Character existingCharacter(CampaignState state, CombatantSpec spec) {
        if (spec.id() != null && !spec.id().isBlank()) {
            Character byId = state.findById(spec.id());
            if (byId != null) {
                return byId;
            }
        }
        if (spec.name() == null) {
            return null;
        }
        List<Character> named = state.roster().stream()
                .filter(c -> c.name().equals(spec.name()))
                .toList();
        if (named.size() > 1) {
            throw GameStateException.notFound("Character name is ambiguous (" + named.size() + " matches): " + spec.name());
        }
        return named.isEmpty() ? null : named.get(0);
    }

    private static CombatEncounter requireCombat(CampaignState state) {
        if (!state.hasActiveCombat()) {
            throw GameStateException.invalidState("No active combat in " + state.campaignId());
        }
        return state.combat();
    }

    private static CombatEncounter requireInTurnOrder(CampaignState state, Character c) {
        CombatEncounter combat = requireCombat(state);
        if (!combat.inTurnOrder(c.id())) {
            throw GameStateException.invalidState(c.name() + " is not in the turn order");
        }
        return combat;
    }

    private static ToIntFunction<String> initiativeOf(CampaignState state) {
        return id -> {
            Character c = state.findById(id);
            return c == null ? 0 : c.initiative();
        };
    }

    private static Predicate<String> isEnemy(CampaignState state) {
        return id -> {
            Character c = state.findById(id);
            return c != null && !c.isPlayerCharacter();
        };
    }

    private static CharacterStatePayload characterPayload(CampaignState state, String characterId) {
        Character c = state.findById(characterId);
        return new CharacterStatePayload(state.version(), c, c.vitality(), state.combatView());
    }

    static int intValue(String key, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw GameStateException.validation(key + " needs a number");
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                throw GameStateException.validation(key + " needs a number, got '" + value.asText() + "'");
            }
        }
        throw GameStateException.validation(key + " needs a number, got " + value);
    }

    /** Death save counts default to one. */
    static int countValue(String key, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()
                || (value.isTextual() && value.asText().isBlank())) {
            return 1;
        }
        return intValue(key, value);
    }

    static String textValue(String key, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode() || value.asText().isBlank()) {
            throw GameStateException.validation(key + " needs a value");
        }
        return value.asText();
    }

    /** An array of names, or one comma-separated string. */
    static List<String> stringList(JsonNode value) {
        List<String> result = new ArrayList<>();
        if (value == null || value.isNull() || value.isMissingNode()) {
            return result;
        }
        if (value.isArray()) {
            Iterator<JsonNode> it = value.elements();
            while (it.hasNext()) {
                result.add(it.next().asText());
            }
            return result;
        }
        for (String part : value.asText().split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }
}
