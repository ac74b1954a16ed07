package dev.ebullient.riddle.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.riddle.TestGame;
import dev.ebullient.riddle.model.CombatStatePayload;

class ToolExecutorTest {

    @TempDir
    Path tempDir;

    TestGame game;
    ToolExecutor executor;
    String campaignId;

    @BeforeEach
    void setUp() {
        game = new TestGame(tempDir);
        executor = game.executor;
        campaignId = game.store.create("Tools").campaignId();
    }

    JsonNode json(String text) throws Exception {
        return game.objectMapper.readTree(text);
    }

    ToolResult run(String tool, String args) throws Exception {
        return executor.execute(campaignId, tool, json(args));
    }

    void startFight() throws Exception {
        ToolResult started = run("start_combat", """
                {"combatants": [
                  {"id": "elara", "name": "Elara", "type": "PC", "initiative": 18, "currentHp": 3, "maxHp": 20},
                  {"id": "goblin", "name": "Goblin", "type": "enemy", "initiative": 12, "currentHp": 2, "maxHp": 7}
                ]}
                """);
        assertTrue(started.success(), started.error());
    }

    @Test
    void startCombat_reportsRoutedEvent() throws Exception {
        ToolResult result = run("start_combat", """
                {"combatants": [{"name": "Thorin", "type": "PC", "initiative": 15, "maxHp": 24}]}
                """);

        assertTrue(result.success());
        assertEquals(1, result.events().size());
        ToolResult.RoutedEvent event = result.events().get(0);
        assertEquals("CombatStarted", event.type());
        assertEquals(List.of("all"), event.audiences());
        assertEquals("Thorin", ((CombatStatePayload) event.payload()).turnOrder().get(0).name());
    }

    @Test
    void updateCharacterState_scenario() throws Exception {
        startFight();
        ToolResult result = run("update_character_state",
                "{\"characterNameOrId\": \"Elara\", \"key\": \"current_hp\", \"value\": 0}");

        assertTrue(result.success());
        assertEquals("CharacterStateUpdated", result.events().get(0).type());
        JsonNode payload = game.objectMapper.valueToTree(result.events().get(0).payload());
        assertEquals("Unconscious", payload.path("character").path("conditions").get(0).asText());
        assertEquals("UNCONSCIOUS", payload.path("state").asText());
        assertEquals(0, payload.path("combat").path("turnOrder").get(0).path("currentHp").asInt());
    }

    @Test
    void markDefeated_endsCombat() throws Exception {
        startFight();
        ToolResult result = run("mark_defeated", "{\"characterId\": \"goblin\"}");

        assertTrue(result.success());
        assertEquals("CombatEnded", result.events().get(0).type());
        ToolResult state = run("get_combat_state", "{}");
        assertTrue(state.success());
        assertNull(state.data());
    }

    @Test
    void failures_areTyped() throws Exception {
        ToolResult noCombat = run("advance_turn", "{}");
        assertFalse(noCombat.success());
        assertEquals("INVALID_STATE", noCombat.errorType());

        ToolResult missing = run("set_initiative", "{\"characterId\": \"Nobody\", \"value\": 3}");
        assertEquals("NOT_FOUND", missing.errorType());

        ToolResult badType = run("start_combat",
                "{\"combatants\": [{\"name\": \"X\", \"type\": \"Dragon\", \"initiative\": 1, \"maxHp\": 3}]}");
        assertEquals("VALIDATION", badType.errorType());

        ToolResult unknown = run("cast_fireball", "{}");
        assertEquals("VALIDATION", unknown.errorType());
        assertTrue(unknown.error().contains("start_combat"));

        ToolResult noCampaign = executor.execute("no-such-campaign", "get_game_state", json("{}"));
        assertEquals("NOT_FOUND", noCampaign.errorType());

        assertTrue(game.sink.published.isEmpty());
    }

    @Test
    void persistenceFailure_isReported() throws Exception {
        startFight();
        game.store.failSaves = true;
        ToolResult result = run("advance_turn", "{}");
        game.store.failSaves = false;

        assertEquals("PERSISTENCE", result.errorType());
        assertEquals(0, game.coordinator.getCombatState(campaignId).currentTurnIndex());
    }

    @Test
    void sceneTools() throws Exception {
        ToolResult choices = run("present_player_choices", "{\"choices\": [\"Fight\", \"Flee\"]}");
        assertEquals(List.of("players"), choices.events().get(0).audiences());

        ToolResult submitted = run("submit_player_choice", "{\"choice\": \"Flee\"}");
        assertEquals(List.of("dm"), submitted.events().get(0).audiences());

        ToolResult pulse = run("send_atmosphere_pulse", "{\"text\": \"Wind howls\", \"sensoryType\": \"Sound\"}");
        assertEquals("AtmospherePulseReceived", pulse.events().get(0).type());

        ToolResult readAloud = run("display_read_aloud_text", "{\"text\": \"Welcome\"}");
        assertEquals(List.of("dm"), readAloud.events().get(0).audiences());
    }

    @Test
    void logAndTableTools() throws Exception {
        startFight();

        ToolResult logged = run("update_game_log", "{\"entry\": \"Goblins ambushed the party\"}");
        assertTrue(logged.success(), logged.error());
        assertTrue(logged.events().isEmpty());
        JsonNode entry = game.objectMapper.valueToTree(logged.data());
        assertEquals("standard", entry.path("importance").asText());

        ToolResult roll = run("log_player_roll", """
                {"characterId": "elara", "checkType": "Attack", "result": "19", "outcome": "Hit"}
                """);
        assertTrue(roll.success(), roll.error());
        assertEquals("PlayerRollLogged", roll.events().get(0).type());
        assertEquals(List.of("all"), roll.events().get(0).audiences());

        ToolResult image = run("update_scene_image", "{\"description\": \"A goblin camp at dusk\"}");
        assertEquals("SceneImageUpdated", image.events().get(0).type());
        assertEquals(List.of("all"), image.events().get(0).audiences());

        assertEquals(2, game.coordinator.getGameState(campaignId).gameLog().size());
        assertEquals(List.of("PlayerRollLogged", "SceneImageUpdated"), game.sink.eventNames().subList(1, 3));

        ToolResult missing = run("log_player_roll", "{\"characterId\": \"elara\", \"checkType\": \"Attack\"}");
        assertFalse(missing.success());
        assertEquals("VALIDATION", missing.errorType());
    }

    @Test
    void getGameState_includesVersionAndCombat() throws Exception {
        startFight();
        ToolResult result = run("get_game_state", "{}");

        JsonNode data = game.objectMapper.valueToTree(result.data());
        assertEquals(1, data.path("version").asLong());
        assertEquals("goblin", data.path("combat").path("turnOrder").get(1).path("id").asText());
        assertEquals(2, data.path("campaign").path("roster").size());
    }

    @Test
    void executeToJson_serializesFailure() throws Exception {
        JsonNode node = json(executor.executeToJson(campaignId, "end_combat", json("{}")));

        assertFalse(node.path("success").asBoolean());
        assertEquals("INVALID_STATE", node.path("errorType").asText());
        assertFalse(node.has("events"));
    }
}
