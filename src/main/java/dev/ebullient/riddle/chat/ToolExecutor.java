package dev.ebullient.riddle.chat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import dev.ebullient.riddle.CombatCoordinator;
import dev.ebullient.riddle.GameStateException;
import dev.ebullient.riddle.MutationResult;
import dev.ebullient.riddle.SceneService;
import dev.ebullient.riddle.model.CampaignState;
import dev.ebullient.riddle.model.CombatantSpec;
import dev.ebullient.riddle.model.LogEntry;
import dev.ebullient.riddle.notify.Audience;

/**
 * The tool-invocation gateway: runs a named tool with JSON arguments against
 * one campaign and reports success with the routed events, or a typed
 * failure. Failures never leave a partial change behind.
 */
@Singleton
public class ToolExecutor {
    private static final Logger log = Logger.getLogger(ToolExecutor.class);

    static final Set<String> TOOL_NAMES = Set.of(
            "start_combat", "set_initiative", "advance_turn", "update_character_state",
            "mark_defeated", "end_combat", "add_combatant", "remove_combatant",
            "get_game_state", "get_combat_state",
            "present_player_choices", "submit_player_choice", "send_atmosphere_pulse",
            "set_narrative_anchor", "trigger_group_insight", "display_read_aloud_text",
            "update_game_log", "log_player_roll", "update_scene_image");

    @Inject
    CombatCoordinator coordinator;

    @Inject
    SceneService scene;

    @Inject
    ObjectMapper objectMapper;

    public ToolResult execute(String campaignId, String toolName, JsonNode args) {
        JsonNode a = args == null ? NullNode.getInstance() : args;
        try {
            return switch (toolName == null ? "" : toolName) {
                case "start_combat" -> routed(coordinator.startCombat(campaignId, combatants(a.path("combatants"))));
                case "set_initiative" -> routed(coordinator.setInitiative(campaignId, characterRef(a),
                        intArg(a, "value")));
                case "advance_turn" -> routed(coordinator.advanceTurn(campaignId));
                case "update_character_state" -> routed(coordinator.updateCharacterState(campaignId,
                        characterRef(a), text(a, "key"), a.get("value")));
                case "mark_defeated" -> routed(coordinator.markDefeated(campaignId, characterRef(a)));
                case "end_combat" -> routed(coordinator.endCombat(campaignId));
                case "add_combatant" -> routed(coordinator.addCombatant(campaignId,
                        combatant(a.has("combatant") ? a.get("combatant") : a)));
                case "remove_combatant" -> routed(coordinator.removeCombatant(campaignId, characterRef(a)));
                case "get_game_state" -> ToolResult.ok(gameState(coordinator.getGameState(campaignId)), List.of());
                case "get_combat_state" -> ToolResult.ok(coordinator.getCombatState(campaignId), List.of());
                case "present_player_choices" -> routed(scene.presentPlayerChoices(campaignId,
                        strings(a.path("choices"))));
                case "submit_player_choice" -> routed(scene.submitPlayerChoice(campaignId,
                        characterRef(a), text(a, "choice")));
                case "send_atmosphere_pulse" -> routed(scene.sendAtmospherePulse(campaignId,
                        text(a, "text"), text(a, "intensity"), text(a, "sensoryType")));
                case "set_narrative_anchor" -> routed(scene.setNarrativeAnchor(campaignId,
                        text(a, "shortText"), text(a, "moodCategory")));
                case "trigger_group_insight" -> routed(scene.triggerGroupInsight(campaignId,
                        text(a, "text"), text(a, "relevantSkill"), a.path("highlightEffect").asBoolean(false)));
                case "display_read_aloud_text" -> routed(scene.displayReadAloudText(campaignId, text(a, "text")));
                case "update_game_log" -> logged(scene.updateGameLog(campaignId, text(a, "entry"),
                        text(a, "importance")));
                case "log_player_roll" -> routed(scene.logPlayerRoll(campaignId, characterRef(a),
                        text(a, "checkType"), intArg(a, "result"), text(a, "outcome")));
                case "update_scene_image" -> routed(scene.updateSceneImage(campaignId, text(a, "description"),
                        text(a, "imageUri")));
                default -> ToolResult.failure(GameStateException.ErrorKind.VALIDATION.name(),
                        "Unknown tool: " + toolName + ", expected one of " + new TreeSet<>(TOOL_NAMES));
            };
        } catch (GameStateException e) {
            log.debugf("%s: %s failed (%s): %s", campaignId, toolName, e.kind(), e.getMessage());
            if (e.kind() == GameStateException.ErrorKind.PERSISTENCE) {
                log.errorf(e, "%s: %s could not be saved", campaignId, toolName);
            }
            return ToolResult.failure(e.kind().name(), e.getMessage());
        } catch (IllegalArgumentException e) {
            log.debugf("%s: %s rejected: %s", campaignId, toolName, e.getMessage());
            return ToolResult.failure(GameStateException.ErrorKind.VALIDATION.name(), e.getMessage());
        }
    }

    /** Same as {@link #execute}, serialized. */
    public String executeToJson(String campaignId, String toolName, JsonNode args) {
        ToolResult result = execute(campaignId, toolName, args);
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result of " + toolName, e);
        }
    }

    /** The stored aggregate plus the combat as receivers see it. */
    private static Map<String, Object> gameState(CampaignState state) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("version", state.version());
        data.put("campaign", state);
        data.put("combat", state.combatView());
        return data;
    }

    /** A silent change: the new log entry, no events. */
    private static ToolResult logged(MutationResult result) {
        List<LogEntry> entries = result.state().gameLog();
        return ToolResult.ok(entries.get(entries.size() - 1), List.of());
    }

    private ToolResult routed(MutationResult result) {
        List<String> audiences = result.audiences().stream().map(Audience::key).toList();
        return ToolResult.ok(null, List.of(new ToolResult.RoutedEvent(
                result.event().eventName(), audiences, result.event().payload())));
    }

    private List<CombatantSpec> combatants(JsonNode node) {
        if (!node.isArray()) {
            throw GameStateException.validation("combatants must be a list");
        }
        return objectMapper.convertValue(node, new TypeReference<List<CombatantSpec>>() {
        });
    }

    private CombatantSpec combatant(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw GameStateException.validation("combatant must be an object");
        }
        return objectMapper.convertValue(node, CombatantSpec.class);
    }

    /** Tools name their target by id or name under one of a few keys. */
    static String characterRef(JsonNode args) {
        for (String key : List.of("characterNameOrId", "characterId", "characterName")) {
            String value = text(args, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String text(JsonNode args, String key) {
        JsonNode node = args.get(key);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }

    static int intArg(JsonNode args, String key) {
        JsonNode node = args.get(key);
        if (node == null || node.isNull()) {
            throw GameStateException.validation(key + " is required");
        }
        if (node.canConvertToInt() && node.isIntegralNumber()) {
            return node.intValue();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            throw GameStateException.validation(key + " needs a number, got '" + node.asText() + "'");
        }
    }

    static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> values.add(n.asText()));
        }
        return values;
    }
}
