package dev.ebullient.riddle;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.riddle.model.CampaignState;
import dev.ebullient.riddle.model.Character;
import dev.ebullient.riddle.model.LogEntry;
import dev.ebullient.riddle.model.ScenePayloads;
import dev.ebullient.riddle.notify.Audience;
import dev.ebullient.riddle.notify.EventType;
import dev.ebullient.riddle.notify.GameEvent;
import dev.ebullient.riddle.notify.NotificationRouter;

/**
 * Scene events between the DM and the players: choice lists, submitted
 * choices, atmosphere cues, read-aloud text, dice rolls, the scene image,
 * character claims and presence.
 * <p>
 * The presented choice list, the game log, the scene image and character
 * claims are campaign state; they are committed through
 * {@link CombatCoordinator#mutate}. Everything else is published as is,
 * after checking that the campaign exists.
 */
@Singleton
public class SceneService {
    private static final Logger log = Logger.getLogger(SceneService.class);

    static final Set<String> INTENSITIES = Set.of("Low", "Medium", "High");
    static final Set<String> SENSORY_TYPES = Set.of("Sound", "Smell", "Visual", "Feeling");
    static final int ANCHOR_MAX_WORDS = 10;
    static final int SCENE_PLACEHOLDERS = 10;

    @Inject
    CombatCoordinator coordinator;

    @Inject
    CampaignStore store;

    @Inject
    NotificationRouter router;

    public MutationResult presentPlayerChoices(String campaignId, List<String> choices) {
        List<String> cleaned = choices == null ? List.of()
                : choices.stream()
                        .filter(c -> c != null && !c.isBlank())
                        .map(String::trim)
                        .toList();
        if (cleaned.isEmpty()) {
            throw GameStateException.validation("At least one choice is required");
        }
        return coordinator.mutate(campaignId, "present_player_choices",
                state -> new CombatCoordinator.Change(state.withActivePlayerChoices(cleaned),
                        EventType.PLAYER_CHOICES_RECEIVED,
                        s -> new ScenePayloads.PlayerChoices(s.version(), s.activePlayerChoices())));
    }

    /** A player's answer, for the DM only. */
    public MutationResult submitPlayerChoice(String campaignId, String characterIdOrName, String choice) {
        if (choice == null || choice.isBlank()) {
            throw GameStateException.validation("Choice text is required");
        }
        CampaignState state = coordinator.getGameState(campaignId);
        String characterId = null;
        String characterName = characterIdOrName;
        if (characterIdOrName != null && !characterIdOrName.isBlank()) {
            Character c = state.resolveCharacter(characterIdOrName);
            characterId = c.id();
            characterName = c.name();
        }
        return publish(state, EventType.PLAYER_CHOICE_SUBMITTED,
                new ScenePayloads.PlayerChoice(characterId, characterName, choice.trim(), Instant.now()));
    }

    public MutationResult sendAtmospherePulse(String campaignId, String text, String intensity, String sensoryType) {
        requireText("Pulse text", text);
        String level = oneOf("intensity", intensity, INTENSITIES, "Low");
        String sense = oneOf("sensory type", sensoryType, SENSORY_TYPES, null);
        return publish(store.load(campaignId), EventType.ATMOSPHERE_PULSE,
                new ScenePayloads.AtmospherePulse(text.trim(), level, sense));
    }

    public MutationResult setNarrativeAnchor(String campaignId, String shortText, String moodCategory) {
        requireText("Anchor text", shortText);
        if (shortText.trim().split("\\s+").length > ANCHOR_MAX_WORDS) {
            throw GameStateException.validation("Anchor text must be " + ANCHOR_MAX_WORDS + " words or fewer");
        }
        return publish(store.load(campaignId), EventType.NARRATIVE_ANCHOR,
                new ScenePayloads.NarrativeAnchor(shortText.trim(), moodCategory));
    }

    public MutationResult triggerGroupInsight(String campaignId, String text, String relevantSkill, boolean highlight) {
        requireText("Insight text", text);
        return publish(store.load(campaignId), EventType.GROUP_INSIGHT,
                new ScenePayloads.GroupInsight(text.trim(), relevantSkill, highlight));
    }

    public MutationResult displayReadAloudText(String campaignId, String text) {
        requireText("Read-aloud text", text);
        return publish(store.load(campaignId), EventType.READ_ALOUD_TEXT,
                new ScenePayloads.ReadAloudText(text.trim()));
    }

    /** Add a narrative log entry. Nothing is published. */
    public MutationResult updateGameLog(String campaignId, String entry, String importance) {
        requireText("Log entry", entry);
        return coordinator.mutate(campaignId, "update_game_log",
                state -> new CombatCoordinator.Change(state.withLogEntry(LogEntry.of(entry, importance)), null,
                        s -> null));
    }

    /** Record a roll in the game log and show it to everyone. */
    public MutationResult logPlayerRoll(String campaignId, String characterIdOrName, String checkType, int result,
            String outcome) {
        requireText("Check type", checkType);
        requireText("Outcome", outcome);
        return coordinator.mutate(campaignId, "log_player_roll", state -> {
            Character c = state.resolveCharacter(characterIdOrName);
            LogEntry entry = LogEntry.of("[Roll] " + c.name() + ": " + checkType.trim() + " = " + result
                    + " (" + outcome.trim() + ")", LogEntry.MINOR);
            return new CombatCoordinator.Change(state.withLogEntry(entry), EventType.PLAYER_ROLL_LOGGED,
                    s -> new ScenePayloads.PlayerRoll(s.version(), entry.id(), c.id(), c.name(),
                            checkType.trim(), result, outcome.trim(), entry.timestamp()));
        });
    }

    /**
     * Change the scene image. Without an explicit image the description picks
     * one of the placeholder scenes.
     */
    public MutationResult updateSceneImage(String campaignId, String description, String imageUri) {
        requireText("Scene description", description);
        String uri = imageUri == null || imageUri.isBlank()
                ? placeholderImage(description.trim())
                : imageUri.trim();
        return coordinator.mutate(campaignId, "update_scene_image",
                state -> new CombatCoordinator.Change(state.withSceneImageUri(uri), EventType.SCENE_IMAGE_UPDATED,
                        s -> new ScenePayloads.SceneImage(s.version(), s.sceneImageUri(), description.trim())));
    }

    /**
     * A player takes a player character. Claiming again by the same player is
     * allowed; a character held by someone else is not.
     */
    public MutationResult claimCharacter(String campaignId, String characterIdOrName, String playerId,
            String playerName) {
        requireText("Player id", playerId);
        return coordinator.mutate(campaignId, "claim " + characterIdOrName, state -> {
            Character c = state.resolveCharacter(characterIdOrName);
            if (!c.isPlayerCharacter()) {
                throw GameStateException.invalidState(c.name() + " is not a player character");
            }
            if (c.playerId() != null && !c.playerId().equals(playerId)) {
                throw GameStateException.invalidState(c.name() + " is already claimed by "
                        + (c.playerName() == null ? c.playerId() : c.playerName()));
            }
            Character claimed = c.withPlayer(playerId, playerName);
            return new CombatCoordinator.Change(state.withCharacter(claimed), EventType.CHARACTER_CLAIMED,
                    s -> new ScenePayloads.CharacterClaim(s.version(), c.id(), c.name(), playerId, playerName, true));
        });
    }

    public MutationResult releaseCharacter(String campaignId, String characterIdOrName) {
        return coordinator.mutate(campaignId, "release " + characterIdOrName, state -> {
            Character c = state.resolveCharacter(characterIdOrName);
            if (c.playerId() == null) {
                throw GameStateException.invalidState(c.name() + " is not claimed");
            }
            return new CombatCoordinator.Change(state.withCharacter(c.withPlayer(null, null)),
                    EventType.CHARACTER_RELEASED,
                    s -> new ScenePayloads.CharacterClaim(s.version(), c.id(), c.name(), c.playerId(),
                            c.playerName(), false));
        });
    }

    public MutationResult playerConnected(String campaignId, String connectionId, String characterId, String characterName) {
        return publish(store.load(campaignId), EventType.PLAYER_CONNECTED,
                new ScenePayloads.PlayerConnection(connectionId, characterId, characterName, true));
    }

    public MutationResult playerDisconnected(String campaignId, String connectionId, String characterId,
            String characterName) {
        return publish(store.load(campaignId), EventType.PLAYER_DISCONNECTED,
                new ScenePayloads.PlayerConnection(connectionId, characterId, characterName, false));
    }

    private MutationResult publish(CampaignState state, EventType type, Object payload) {
        GameEvent event = new GameEvent(state.campaignId(), type, payload);
        Set<Audience> audiences = router.publish(event);
        log.debugf("Campaign %s: %s", state.campaignId(), event.eventName());
        return new MutationResult(state, event, audiences);
    }

    static String placeholderImage(String description) {
        return "/images/scenes/placeholder_" + Math.floorMod(description.hashCode(), SCENE_PLACEHOLDERS) + ".png";
    }

    private static void requireText(String what, String text) {
        if (text == null || text.isBlank()) {
            throw GameStateException.validation(what + " is required");
        }
    }

    private static String oneOf(String what, String value, Set<String> allowed, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        for (String a : allowed) {
            if (a.equalsIgnoreCase(value.trim())) {
                return a;
            }
        }
        throw GameStateException.validation("Unknown " + what + ": " + value + " (expected one of " + allowed + ")");
    }
}
