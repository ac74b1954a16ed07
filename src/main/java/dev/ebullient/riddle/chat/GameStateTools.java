package dev.ebullient.riddle.chat;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.ebullient.riddle.model.CombatantSpec;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.agent.tool.ToolMemoryId;

/**
 * Game-state tools for an AI assistant acting as the DM's helper. The chat
 * memory id is the campaign id. Every tool returns the JSON tool result.
 */
@ApplicationScoped
public class GameStateTools {
    private static final Logger log = Logger.getLogger(GameStateTools.class);

    @Inject
    ToolExecutor executor;

    @Inject
    ObjectMapper objectMapper;

    @Tool("""
            Start combat. Combatants already on the roster are matched by id or exact name
            and keep their hit points unless currentHp is given; new ones need maxHp.
            Defeated enemies cannot join. Turn order is by initiative, highest first.
            Fails if a combat is already running.
            """)
    public String startCombat(@P("The combatants with their initiative rolls") List<CombatantSpec> combatants,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.set("combatants", objectMapper.valueToTree(combatants));
        return call(campaignId, "start_combat", args);
    }

    @Tool("Change a combatant's initiative. The turn order is re-sorted; the current turn does not move.")
    public String setInitiative(@P("Character id or exact name") String characterId,
            @P("New initiative") int value,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("characterId", characterId);
        args.put("value", value);
        return call(campaignId, "set_initiative", args);
    }

    @Tool("End the current combatant's turn. After the last combatant a new round starts.")
    public String advanceTurn(@ToolMemoryId String campaignId) {
        return call(campaignId, "advance_turn", objectMapper.createObjectNode());
    }

    @Tool("""
            Update one aspect of a character. Keys:
            current_hp, temporary_hp, damage (numbers);
            conditions (list), add_condition, remove_condition (condition name);
            status_notes (text); initiative (number);
            death_save_success, death_save_failure (count, default 1);
            stabilize (no value).
            Hit points are clamped to 0..max. A player character at 0 hp is Unconscious
            and makes death saves; an enemy at 0 hp is defeated.
            """)
    public String updateCharacterState(@P("Character id or exact name") String characterNameOrId,
            @P("Which aspect to change") String key,
            @P("The new value, as text") String value,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("characterNameOrId", characterNameOrId);
        args.put("key", key);
        args.set("value", parseValue(value));
        return call(campaignId, "update_character_state", args);
    }

    @Tool("Mark an enemy or NPC as defeated. Combat ends when no enemy is left.")
    public String markDefeated(@P("Character id or exact name") String characterId,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("characterId", characterId);
        return call(campaignId, "mark_defeated", args);
    }

    @Tool("End the current combat.")
    public String endCombat(@ToolMemoryId String campaignId) {
        return call(campaignId, "end_combat", objectMapper.createObjectNode());
    }

    @Tool("Add a combatant to the running combat (reinforcements, a late arrival).")
    public String addCombatant(@P("The combatant to add") CombatantSpec combatant,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.set("combatant", objectMapper.valueToTree(combatant));
        return call(campaignId, "add_combatant", args);
    }

    @Tool("Remove a combatant who left the fight without being defeated (fled, dismissed).")
    public String removeCombatant(@P("Character id or exact name") String characterId,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("characterId", characterId);
        return call(campaignId, "remove_combatant", args);
    }

    @Tool("Get the full campaign state: roster, combat and the open player choices.")
    public String getGameState(@ToolMemoryId String campaignId) {
        return call(campaignId, "get_game_state", objectMapper.createObjectNode());
    }

    @Tool("Get the current combat: turn order, round and whose turn it is. Null when there is no combat.")
    public String getCombatState(@ToolMemoryId String campaignId) {
        return call(campaignId, "get_combat_state", objectMapper.createObjectNode());
    }

    @Tool("Show the players a list of choices.")
    public String presentPlayerChoices(@P("The choices, short sentences") List<String> choices,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.set("choices", objectMapper.valueToTree(choices));
        return call(campaignId, "present_player_choices", args);
    }

    @Tool("Send a fleeting sensory cue to the players' screens.")
    public String sendAtmospherePulse(@P("Short evocative text") String text,
            @P("Low, Medium or High") String intensity,
            @P("Sound, Smell, Visual or Feeling") String sensoryType,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("text", text);
        args.put("intensity", intensity);
        args.put("sensoryType", sensoryType);
        return call(campaignId, "send_atmosphere_pulse", args);
    }

    @Tool("Set the persistent scene banner on the players' screens (ten words or fewer).")
    public String setNarrativeAnchor(@P("Banner text") String shortText,
            @P("Mood, e.g. tense, calm, mysterious") String moodCategory,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("shortText", shortText);
        args.put("moodCategory", moodCategory);
        return call(campaignId, "set_narrative_anchor", args);
    }

    @Tool("Share something the whole party notices.")
    public String triggerGroupInsight(@P("What they notice") String text,
            @P("The skill that noticed it") String relevantSkill,
            @P("Highlight on screen") boolean highlightEffect,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("text", text);
        args.put("relevantSkill", relevantSkill);
        args.put("highlightEffect", highlightEffect);
        return call(campaignId, "trigger_group_insight", args);
    }

    @Tool("Give the DM boxed text to read aloud.")
    public String displayReadAloudText(@P("The text") String text, @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("text", text);
        return call(campaignId, "display_read_aloud_text", args);
    }

    @Tool("Record an event in the campaign's narrative log. Players do not see it.")
    public String updateGameLog(@P("What happened") String entry,
            @P("minor, standard or critical") String importance,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("entry", entry);
        args.put("importance", importance);
        return call(campaignId, "update_game_log", args);
    }

    @Tool("Show a dice roll result on every screen and record it in the game log.")
    public String logPlayerRoll(@P("Character id or exact name") String characterId,
            @P("What was rolled, e.g. Perception check") String checkType,
            @P("The total rolled") int result,
            @P("Success, Failure, Critical Success...") String outcome,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("characterId", characterId);
        args.put("checkType", checkType);
        args.put("result", result);
        args.put("outcome", outcome);
        return call(campaignId, "log_player_roll", args);
    }

    @Tool("Change the scene image shown to everyone, based on a description of the scene.")
    public String updateSceneImage(@P("The scene to show") String description,
            @ToolMemoryId String campaignId) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("description", description);
        return call(campaignId, "update_scene_image", args);
    }

    private String call(String campaignId, String toolName, JsonNode args) {
        log.debugf("%s: tool %s %s", campaignId, toolName, args);
        return executor.executeToJson(campaignId, toolName, args);
    }

    /** Numbers and lists arrive as text; keep them typed when they parse as JSON. */
    JsonNode parseValue(String value) {
        if (value == null) {
            return objectMapper.nullNode();
        }
        String trimmed = value.trim();
        if (trimmed.matches("-?\\d+") || trimmed.startsWith("[")) {
            try {
                return objectMapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                log.debugf("Value %s is not JSON, passing it as text", trimmed);
            }
        }
        return objectMapper.getNodeFactory().textNode(value);
    }
}
