package dev.ebullient.riddle.model;

import java.time.Instant;
import java.util.List;

/** Payloads for the non-combat audience events. */
public final class ScenePayloads {

    private ScenePayloads() {
    }

    public record PlayerChoices(long version, List<String> choices) {
    }

    public record PlayerChoice(String characterId, String characterName, String choice, Instant timestamp) {
    }

    /** Fleeting sensory text. Intensity: Low, Medium, High. Sensory type: Sound, Smell, Visual, Feeling. */
    public record AtmospherePulse(String text, String intensity, String sensoryType) {
    }

    /** Persistent banner on player screens; short text of ten words or fewer. */
    public record NarrativeAnchor(String shortText, String moodCategory) {
    }

    public record GroupInsight(String text, String relevantSkill, boolean highlightEffect) {
    }

    public record ReadAloudText(String text) {
    }

    public record PlayerConnection(String connectionId, String characterId, String characterName, boolean online) {
    }

    /** A dice roll shown on every screen; {@code logId} is the matching game log entry. */
    public record PlayerRoll(long version, String logId, String characterId, String characterName,
            String checkType, int result, String outcome, Instant timestamp) {
    }

    public record SceneImage(long version, String imageUri, String description) {
    }

    public record CharacterClaim(long version, String characterId, String characterName,
            String playerId, String playerName, boolean claimed) {
    }
}
