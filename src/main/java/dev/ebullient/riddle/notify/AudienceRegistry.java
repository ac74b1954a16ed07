package dev.ebullient.riddle.notify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.riddle.GameStateException;

/**
 * Which open connections belong to which audience group. A DM connection is
 * in the {@code dm} and {@code all} groups of its campaign, a player
 * connection in {@code players} and {@code all}.
 */
@Singleton
public class AudienceRegistry {
    private static final Logger log = Logger.getLogger(AudienceRegistry.class);

    public record Member(
            String connectionId,
            String campaignId,
            Audience role,
            String characterId,
            String characterName) {
    }

    private final Map<String, Member> members = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> groups = new ConcurrentHashMap<>();

    public Member join(String campaignId, String connectionId, Audience role, String characterId, String characterName) {
        if (role == Audience.ALL) {
            throw GameStateException.validation("A connection joins as dm or players, not all");
        }
        Member member = new Member(connectionId, campaignId, role, characterId, characterName);
        Member previous = members.put(connectionId, member);
        if (previous != null) {
            removeFromGroups(previous);
        }
        group(role.groupName(campaignId)).add(connectionId);
        group(Audience.ALL.groupName(campaignId)).add(connectionId);
        log.debugf("Connection %s joined %s as %s", connectionId, campaignId, role.key());
        return member;
    }

    /** @return the member that left, or null if the connection was not registered */
    public Member leave(String connectionId) {
        Member member = members.remove(connectionId);
        if (member != null) {
            removeFromGroups(member);
            log.debugf("Connection %s left %s", connectionId, member.campaignId());
        }
        return member;
    }

    public Member member(String connectionId) {
        return members.get(connectionId);
    }

    /** Connection ids currently in one group. */
    public Set<String> connections(String campaignId, Audience audience) {
        Set<String> group = groups.get(audience.groupName(campaignId));
        return group == null ? Set.of() : Set.copyOf(group);
    }

    public List<Member> players(String campaignId) {
        List<Member> result = new ArrayList<>();
        for (String id : connections(campaignId, Audience.PLAYERS)) {
            Member m = members.get(id);
            if (m != null) {
                result.add(m);
            }
        }
        return result;
    }

    private Set<String> group(String name) {
        return groups.computeIfAbsent(name, k -> ConcurrentHashMap.newKeySet());
    }

    private void removeFromGroups(Member member) {
        for (Audience audience : List.of(member.role(), Audience.ALL)) {
            String name = audience.groupName(member.campaignId());
            Set<String> group = groups.get(name);
            if (group != null) {
                group.remove(member.connectionId());
                if (group.isEmpty()) {
                    groups.remove(name, group);
                }
            }
        }
    }
}
