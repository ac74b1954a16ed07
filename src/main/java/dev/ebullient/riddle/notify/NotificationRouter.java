package dev.ebullient.riddle.notify;

import java.util.EnumSet;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

/**
 * Decides which audience groups see an event and hands the event to the
 * sink once per group.
 * <p>
 * Delivery is fire-and-forget: a sink failure is logged and does not reach
 * the caller, whose state change is already committed.
 */
@Singleton
public class NotificationRouter {
    private static final Logger log = Logger.getLogger(NotificationRouter.class);

    @Inject
    NotificationSink sink;

    /** The routing table. */
    public Set<Audience> audiencesFor(EventType type) {
        return switch (type.category()) {
            case COMBAT_LIFECYCLE, CHARACTER_STATE, TABLE -> EnumSet.of(Audience.ALL);
            case PLAYER_CHOICE, DM_NARRATION, PRESENCE -> EnumSet.of(Audience.DM);
            case DM_CHOICES, ATMOSPHERE -> EnumSet.of(Audience.PLAYERS);
        };
    }

    /**
     * Publish one message per interested group.
     *
     * @return the groups the event was routed to
     */
    public Set<Audience> publish(GameEvent event) {
        Set<Audience> audiences = audiencesFor(event.type());
        for (Audience audience : audiences) {
            try {
                sink.publish(event.campaignId(), audience, event.eventName(), event.payload());
                log.debugf("Routed %s to %s", event.eventName(), audience.groupName(event.campaignId()));
            } catch (RuntimeException e) {
                log.warnf(e, "Failed to deliver %s to %s", event.eventName(), audience.groupName(event.campaignId()));
            }
        }
        return audiences;
    }
}
