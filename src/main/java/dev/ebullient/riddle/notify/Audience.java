package dev.ebullient.riddle.notify;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Audience {
    DM("dm"),
    PLAYERS("players"),
    ALL("all");

    private final String key;

    Audience(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String groupName(String campaignId) {
        return "campaign_" + campaignId + "_" + key;
    }
}
