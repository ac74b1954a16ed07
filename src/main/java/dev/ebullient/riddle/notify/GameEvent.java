package dev.ebullient.riddle.notify;

/**
 * One change, described as the complete new state of the affected slice.
 * Receivers replace what they hold with the payload.
 */
public record GameEvent(
        String campaignId,
        EventType type,
        Object payload) {

    public String eventName() {
        return type.eventName();
    }
}
