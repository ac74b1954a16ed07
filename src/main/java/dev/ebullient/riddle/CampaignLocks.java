package dev.ebullient.riddle;

import java.util.concurrent.ConcurrentHashMap;

/**
 * One monitor per campaign id. Every read-modify-write of a campaign runs
 * while holding it, so mutations of the same campaign never interleave.
 */
public final class CampaignLocks {

    private static final ConcurrentHashMap<String, Object> CAMPAIGN_LOCKS = new ConcurrentHashMap<>();

    private CampaignLocks() {
    }

    public static Object lockFor(String campaignId) {
        return CAMPAIGN_LOCKS.computeIfAbsent(campaignId, k -> new Object());
    }
}
