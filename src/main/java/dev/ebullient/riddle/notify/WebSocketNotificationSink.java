package dev.ebullient.riddle.notify;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.quarkus.logging.Log;
import io.quarkus.websockets.next.OpenConnections;
import io.quarkus.websockets.next.WebSocketConnection;

/**
 * Pushes envelopes to the open websocket connections of one audience group.
 * Sends are asynchronous; failures are logged per connection.
 */
@Singleton
public class WebSocketNotificationSink implements NotificationSink {

    @Inject
    OpenConnections openConnections;

    @Inject
    AudienceRegistry registry;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public void publish(String campaignId, Audience audience, String eventName, Object payload) {
        Set<String> targets = registry.connections(campaignId, audience);
        if (targets.isEmpty()) {
            Log.debugf("No connections in %s for %s", audience.groupName(campaignId), eventName);
            return;
        }
        String json = envelope(campaignId, audience, eventName, payload);
        for (WebSocketConnection connection : openConnections) {
            if (targets.contains(connection.id()) && connection.isOpen()) {
                connection.sendText(json).subscribe().with(
                        ok -> {
                        },
                        failure -> Log.warnf(failure, "Failed to send %s to connection %s",
                                eventName, connection.id()));
            }
        }
    }

    String envelope(String campaignId, Audience audience, String eventName, Object payload) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", eventName);
        message.put("campaignId", campaignId);
        message.put("audience", audience.key());
        message.put("payload", payload);
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + eventName + " for " + campaignId, e);
        }
    }
}
