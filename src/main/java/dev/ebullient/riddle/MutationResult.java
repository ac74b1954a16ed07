package dev.ebullient.riddle;

import java.util.Set;

import dev.ebullient.riddle.model.CampaignState;
import dev.ebullient.riddle.notify.Audience;
import dev.ebullient.riddle.notify.GameEvent;

/**
 * A committed change: the saved state, the one event describing it, and the
 * audience groups the event was routed to. Silent changes (a game log entry)
 * have no event and no audiences.
 */
public record MutationResult(
        CampaignState state,
        GameEvent event,
        Set<Audience> audiences) {
}
