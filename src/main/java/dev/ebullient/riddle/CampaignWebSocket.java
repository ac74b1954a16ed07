package dev.ebullient.riddle;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.riddle.model.CampaignState;
import dev.ebullient.riddle.model.Character;
import dev.ebullient.riddle.notify.Audience;
import dev.ebullient.riddle.notify.AudienceRegistry;
import io.quarkus.logging.Log;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.PathParam;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;

/**
 * One connection per viewer: {@code role} is {@code dm} or {@code player}.
 * A player may name their character with {@code ?characterId=}.
 * <p>
 * Connections only receive what is routed to their groups; the endpoint
 * itself answers with full state on open and on a {@code state} request.
 */
@WebSocket(path = "/ws/campaign/{campaignId}/{role}")
public class CampaignWebSocket {

    @Inject
    WebSocketConnection connection;

    @Inject
    AudienceRegistry registry;

    @Inject
    CombatCoordinator coordinator;

    @Inject
    SceneService scene;

    @Inject
    ObjectMapper objectMapper;

    @OnOpen
    public String onOpen(@PathParam String campaignId, @PathParam String role) {
        Audience audience = audienceFor(role);
        CampaignState state = coordinator.getGameState(campaignId);

        String characterId = queryParam("characterId");
        String characterName = null;
        if (characterId != null) {
            Character c = state.resolveCharacter(characterId);
            characterId = c.id();
            characterName = c.name();
        }
        registry.join(campaignId, connection.id(), audience, characterId, characterName);
        Log.infof("Campaign WebSocket opened: %s as %s (connection: %s)", campaignId, audience.key(), connection.id());

        if (audience == Audience.PLAYERS) {
            scene.playerConnected(campaignId, connection.id(), characterId, characterName);
        }
        return envelope("connected", campaignId, audience, fullState(state));
    }

    @OnClose
    public void onClose() {
        AudienceRegistry.Member member = registry.leave(connection.id());
        if (member == null) {
            return;
        }
        Log.infof("Campaign WebSocket closed: %s (connection: %s)", member.campaignId(), member.connectionId());
        if (member.role() == Audience.PLAYERS) {
            try {
                scene.playerDisconnected(member.campaignId(), member.connectionId(),
                        member.characterId(), member.characterName());
            } catch (GameStateException e) {
                Log.warnf(e, "Could not announce disconnect of %s from %s", member.connectionId(), member.campaignId());
            }
        }
    }

    @OnError
    public String onError(Throwable error) {
        String campaignId = connection.pathParam("campaignId");
        if (error instanceof GameStateException gse) {
            Log.debugf("Campaign WebSocket request failed: %s: %s", campaignId, gse.getMessage());
            return errorJson(gse.kind().name(), gse.getMessage());
        }
        Log.errorf(error, "Campaign WebSocket error: %s", campaignId);
        return errorJson("ERROR", error.getMessage());
    }

    @OnTextMessage
    public String onMessage(String rawMessage) {
        String campaignId = connection.pathParam("campaignId");
        AudienceRegistry.Member member = registry.member(connection.id());
        if (member == null) {
            return errorJson("INVALID_STATE", "Connection is not registered");
        }
        try {
            JsonNode msg = objectMapper.readTree(rawMessage);
            String type = msg.path("type").asText();
            return switch (type) {
                case "state" -> envelope("state", campaignId, member.role(),
                        fullState(coordinator.getGameState(campaignId)));
                case "submit_choice" -> handleSubmitChoice(campaignId, member, msg);
                case "present_choices" -> handlePresentChoices(campaignId, member, msg);
                case "claim_character" -> handleClaim(campaignId, member, msg);
                case "release_character" -> handleRelease(campaignId, member, msg);
                default -> errorJson("VALIDATION", "Unknown message type: " + type);
            };
        } catch (JsonProcessingException e) {
            Log.debugf("Unreadable message on %s: %s", campaignId, e.getOriginalMessage());
            return errorJson("VALIDATION", "Message is not valid JSON");
        } catch (GameStateException e) {
            return errorJson(e.kind().name(), e.getMessage());
        }
    }

    private String handleSubmitChoice(String campaignId, AudienceRegistry.Member member, JsonNode msg) {
        if (member.role() != Audience.PLAYERS) {
            throw GameStateException.invalidState("Only players submit choices");
        }
        String character = msg.hasNonNull("characterId") ? msg.get("characterId").asText() : member.characterId();
        MutationResult result = scene.submitPlayerChoice(campaignId, character, msg.path("choice").asText(null));
        return ack(campaignId, member, result);
    }

    private String handlePresentChoices(String campaignId, AudienceRegistry.Member member, JsonNode msg) {
        if (member.role() != Audience.DM) {
            throw GameStateException.invalidState("Only the DM presents choices");
        }
        List<String> choices = new ArrayList<>();
        msg.path("choices").forEach(n -> choices.add(n.asText()));
        MutationResult result = scene.presentPlayerChoices(campaignId, choices);
        return ack(campaignId, member, result);
    }

    private String handleClaim(String campaignId, AudienceRegistry.Member member, JsonNode msg) {
        if (member.role() != Audience.PLAYERS) {
            throw GameStateException.invalidState("Only players claim characters");
        }
        String character = msg.hasNonNull("characterId") ? msg.get("characterId").asText() : member.characterId();
        MutationResult result = scene.claimCharacter(campaignId, character,
                msg.path("playerId").asText(null), msg.path("playerName").asText(null));
        return ack(campaignId, member, result);
    }

    private String handleRelease(String campaignId, AudienceRegistry.Member member, JsonNode msg) {
        String character = msg.hasNonNull("characterId") ? msg.get("characterId").asText() : member.characterId();
        MutationResult result = scene.releaseCharacter(campaignId, character);
        return ack(campaignId, member, result);
    }

    private String ack(String campaignId, AudienceRegistry.Member member, MutationResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", result.event().eventName());
        payload.put("version", result.state().version());
        return envelope("ack", campaignId, member.role(), payload);
    }

    private static Map<String, Object> fullState(CampaignState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", state.version());
        payload.put("campaign", state);
        payload.put("combat", state.combatView());
        return payload;
    }

    static Audience audienceFor(String role) {
        if ("dm".equalsIgnoreCase(role)) {
            return Audience.DM;
        }
        if ("player".equalsIgnoreCase(role) || "players".equalsIgnoreCase(role)) {
            return Audience.PLAYERS;
        }
        throw GameStateException.validation("Unknown role: " + role + " (expected dm or player)");
    }

    private String queryParam(String name) {
        String query = connection.handshakeRequest().query();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                return value.isBlank() ? null : value;
            }
        }
        return null;
    }

    private String envelope(String type, String campaignId, Audience audience, Object payload) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("campaignId", campaignId);
        message.put("audience", audience.key());
        message.put("payload", payload);
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            Log.errorf(e, "Failed to serialize %s for %s", type, campaignId);
            return errorJson("ERROR", "Failed to serialize " + type);
        }
    }

    private String errorJson(String errorType, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", "error");
        error.put("errorType", errorType);
        error.put("message", message == null ? "" : message);
        try {
            return objectMapper.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            Log.errorf(e, "Failed to serialize error message");
            return "{\"type\":\"error\"}";
        }
    }
}
