package dev.ebullient.riddle.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.riddle.model.ScenePayloads;

class WebSocketNotificationSinkTest {

    @Test
    void envelope_carriesTypeCampaignAudienceAndPayload() throws Exception {
        WebSocketNotificationSink sink = new WebSocketNotificationSink();
        sink.objectMapper = new ObjectMapper().findAndRegisterModules();

        String json = sink.envelope("c1", Audience.PLAYERS, "PlayerChoicesReceived",
                new ScenePayloads.PlayerChoices(4, List.of("Fight", "Flee")));
        JsonNode node = sink.objectMapper.readTree(json);

        assertEquals("PlayerChoicesReceived", node.get("type").asText());
        assertEquals("c1", node.get("campaignId").asText());
        assertEquals("players", node.get("audience").asText());
        assertEquals(4, node.path("payload").path("version").asInt());
        assertEquals("Flee", node.path("payload").path("choices").get(1).asText());
    }
}
