package dev.ebullient.riddle.notify;

/**
 * Delivers one message to one audience group of a campaign. Implementations
 * must not block on delivery.
 */
public interface NotificationSink {

    void publish(String campaignId, Audience audience, String eventName, Object payload);
}
