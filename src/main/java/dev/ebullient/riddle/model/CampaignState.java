package dev.ebullient.riddle.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.ebullient.riddle.GameStateException;

/**
 * The per-campaign aggregate: roster plus the optional active combat, the
 * open player choices, the narrative log and the current scene image.
 * Saved and loaded as one unit; {@code version} increases with every committed mutation.
 */
public record CampaignState(
        String campaignId,
        String name,
        long version,
        List<Character> roster,
        CombatEncounter combat,
        List<String> activePlayerChoices,
        List<LogEntry> gameLog,
        String sceneImageUri) {

    public CampaignState {
        if (campaignId == null || campaignId.isBlank()) {
            throw new IllegalArgumentException("Campaign id is required");
        }
        roster = roster == null ? List.of() : List.copyOf(roster);
        activePlayerChoices = activePlayerChoices == null ? List.of() : List.copyOf(activePlayerChoices);
        gameLog = gameLog == null ? List.of() : List.copyOf(gameLog);
    }

    public static CampaignState empty(String campaignId, String name) {
        return new CampaignState(campaignId, name, 0, List.of(), null, List.of(), List.of(), null);
    }

    /**
     * Find a character by id, or by exact name when no id matches.
     *
     * @throws GameStateException NOT_FOUND when nothing matches or the name is ambiguous
     */
    public Character resolveCharacter(String idOrName) {
        if (idOrName == null || idOrName.isBlank()) {
            throw GameStateException.notFound("Character id or name is required");
        }
        for (Character c : roster) {
            if (c.id().equals(idOrName)) {
                return c;
            }
        }
        List<Character> byName = roster.stream()
                .filter(c -> c.name().equals(idOrName))
                .toList();
        if (byName.size() == 1) {
            return byName.get(0);
        }
        if (byName.isEmpty()) {
            throw GameStateException.notFound("Character not found: " + idOrName);
        }
        throw GameStateException.notFound("Character name is ambiguous (" + byName.size() + " matches): " + idOrName);
    }

    public Character findById(String id) {
        for (Character c : roster) {
            if (c.id().equals(id)) {
                return c;
            }
        }
        return null;
    }

    public Map<String, Character> rosterById() {
        Map<String, Character> map = new LinkedHashMap<>();
        roster.forEach(c -> map.put(c.id(), c));
        return map;
    }

    public boolean hasActiveCombat() {
        return combat != null && combat.active();
    }

    /** Replace the character with the same id, or append it. */
    public CampaignState withCharacter(Character character) {
        List<Character> updated = new ArrayList<>(roster.size() + 1);
        boolean replaced = false;
        for (Character c : roster) {
            if (c.id().equals(character.id())) {
                updated.add(character);
                replaced = true;
            } else {
                updated.add(c);
            }
        }
        if (!replaced) {
            updated.add(character);
        }
        return new CampaignState(campaignId, name, version, updated, combat, activePlayerChoices, gameLog, sceneImageUri);
    }

    public CampaignState withCombat(CombatEncounter encounter) {
        return new CampaignState(campaignId, name, version, roster, encounter, activePlayerChoices, gameLog, sceneImageUri);
    }

    public CampaignState withActivePlayerChoices(List<String> choices) {
        return new CampaignState(campaignId, name, version, roster, combat, choices, gameLog, sceneImageUri);
    }

    public CampaignState withLogEntry(LogEntry entry) {
        List<LogEntry> entries = new ArrayList<>(gameLog);
        entries.add(entry);
        return new CampaignState(campaignId, name, version, roster, combat, activePlayerChoices, entries,
                sceneImageUri);
    }

    public CampaignState withSceneImageUri(String uri) {
        return new CampaignState(campaignId, name, version, roster, combat, activePlayerChoices, gameLog, uri);
    }

    public CampaignState nextVersion() {
        return new CampaignState(campaignId, name, version + 1, roster, combat, activePlayerChoices, gameLog,
                sceneImageUri);
    }

    /** The combat as receivers see it, built live from the roster. Null when there is no active combat. */
    public CombatStatePayload combatView() {
        if (!hasActiveCombat()) {
            return null;
        }
        Map<String, Character> byId = rosterById();
        List<CombatantView> views = new ArrayList<>();
        for (String id : combat.turnOrder()) {
            Character c = byId.get(id);
            if (c != null) {
                views.add(CombatantView.of(c, combat));
            }
        }
        List<CombatantView> defeated = new ArrayList<>();
        for (String id : combat.defeated()) {
            Character c = byId.get(id);
            if (c != null) {
                defeated.add(CombatantView.of(c, combat));
            }
        }
        return new CombatStatePayload(version, combat.id(), combat.active(), combat.roundNumber(),
                views, combat.currentTurnIndex(), combat.currentCombatantId(), defeated);
    }
}
