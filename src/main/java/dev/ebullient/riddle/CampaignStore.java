package dev.ebullient.riddle;

import java.util.List;

import dev.ebullient.riddle.model.CampaignState;

/**
 * Whole-aggregate persistence. {@link #save} is atomic: after a failure the
 * previously saved state is still the one {@link #load} returns.
 */
public interface CampaignStore {

    /** @throws GameStateException NOT_FOUND when the campaign does not exist */
    CampaignState load(String campaignId);

    /** @throws GameStateException PERSISTENCE when the write fails */
    void save(CampaignState state);

    /** Create and save an empty campaign; the id is derived from the name. */
    CampaignState create(String name);

    boolean exists(String campaignId);

    List<String> listCampaignIds();
}
